package com.vidnyan.k8slint.domain.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Pre-order traversal over every expression of a file, function bodies included.
 */
public final class AstWalker {

    private AstWalker() {
    }

    /**
     * Visits every expression; when {@code visitor} returns false the node's children are skipped.
     */
    public static void walk(SourceFile file, Predicate<Expr> visitor) {
        for (Decl decl : file.decls()) {
            if (decl instanceof GenDecl gen) {
                for (ValueSpec spec : gen.specs()) {
                    if (spec.type() != null) {
                        walk(spec.type(), visitor);
                    }
                    spec.values().forEach(value -> walk(value, visitor));
                }
            } else if (decl instanceof FuncDecl func && func.body() != null) {
                walk(func.body(), visitor);
            }
        }
    }

    public static void walk(Expr root, Predicate<Expr> visitor) {
        if (root == null || !visitor.test(root)) {
            return;
        }
        for (Expr child : root.children()) {
            walk(child, visitor);
        }
    }

    /**
     * All expressions of the given variant, in pre-order.
     */
    public static <T extends Expr> List<T> collect(SourceFile file, Class<T> variant) {
        List<T> found = new ArrayList<>();
        walk(file, expr -> {
            if (variant.isInstance(expr)) {
                found.add(variant.cast(expr));
            }
            return true;
        });
        return found;
    }

    public static List<CompositeLit> compositeLiterals(SourceFile file) {
        return collect(file, CompositeLit.class);
    }

    public static List<BasicLit> stringLiterals(SourceFile file) {
        return collect(file, BasicLit.class).stream().filter(BasicLit::isString).toList();
    }
}
