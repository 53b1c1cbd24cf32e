package com.vidnyan.k8slint.domain.match;

import com.vidnyan.k8slint.domain.ast.BasicLit;
import com.vidnyan.k8slint.domain.ast.CallExpr;
import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.ast.Expr;
import com.vidnyan.k8slint.domain.ast.Ident;
import com.vidnyan.k8slint.domain.ast.KeyValueExpr;
import com.vidnyan.k8slint.domain.ast.SelectorExpr;
import com.vidnyan.k8slint.domain.ast.UnaryExpr;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Null-safe extractors over composite literals. An absent field, an unexpected node
 * shape or a {@code null} argument never throws; it simply does not match.
 * <p>
 * Path hops may name alternatives separated by {@code |}, e.g. {@code "Metadata|ObjectMeta"}.
 */
public final class Matchers {

    /** Returned by {@link #intLiteral(Expr)} when there is no integer literal to read. */
    public static final long UNSET = -1;

    private static final Set<String> CONVERSIONS = Set.of(
            "int", "int8", "int16", "int32", "int64",
            "uint", "uint8", "uint16", "uint32", "uint64", "bool");

    private Matchers() {
    }

    /**
     * Declared type name of a composite literal, unwrapping one {@code &}. For
     * {@code corev1.Container{}} this is {@code Container}. An elided type resolves to
     * the element type of the enclosing literal.
     */
    public static Optional<String> typeNameOf(Expr expr) {
        return nestedRecord(expr).map(CompositeLit::effectiveType).map(Matchers::typeName);
    }

    /**
     * Package qualifier of a literal's type, e.g. {@code corev1}; empty for unqualified types.
     */
    public static Optional<String> packageOf(Expr expr) {
        return nestedRecord(expr)
                .map(CompositeLit::effectiveType)
                .filter(SelectorExpr.class::isInstance)
                .map(type -> ((SelectorExpr) type).operand())
                .filter(Ident.class::isInstance)
                .map(qualifier -> ((Ident) qualifier).name());
    }

    /**
     * The literal itself, or the literal behind one {@code &}.
     */
    public static Optional<CompositeLit> nestedRecord(Expr expr) {
        if (expr instanceof UnaryExpr unary && unary.isAddressOf()) {
            expr = unary.operand();
        }
        return expr instanceof CompositeLit literal ? Optional.of(literal) : Optional.empty();
    }

    public static Optional<KeyValueExpr> field(CompositeLit literal, String name) {
        if (literal == null) {
            return Optional.empty();
        }
        for (Expr element : literal.elements()) {
            if (element instanceof KeyValueExpr keyValue && keyValue.keyName() != null
                    && hopMatches(name, keyValue.keyName())) {
                return Optional.of(keyValue);
            }
        }
        return Optional.empty();
    }

    public static Optional<Expr> fieldValue(CompositeLit literal, String name) {
        return field(literal, name).map(KeyValueExpr::value);
    }

    public static boolean hasField(CompositeLit literal, String name) {
        return field(literal, name).isPresent();
    }

    /**
     * Follows nested literal fields, e.g. {@code path(deploy, "Spec", "Template", "Spec")};
     * empty as soon as a hop is missing or is not a literal.
     */
    public static Optional<CompositeLit> path(CompositeLit root, String... hops) {
        Optional<CompositeLit> current = Optional.ofNullable(root);
        for (String hop : hops) {
            current = current.flatMap(literal -> fieldValue(literal, hop)).flatMap(Matchers::nestedRecord);
            if (current.isEmpty()) {
                break;
            }
        }
        return current;
    }

    /**
     * Value of the last hop of a path, whatever its shape.
     */
    public static Optional<Expr> pathValue(CompositeLit root, String... hops) {
        if (hops.length == 0) {
            return Optional.empty();
        }
        String[] parents = Arrays.copyOf(hops, hops.length - 1);
        return path(root, parents).flatMap(parent -> fieldValue(parent, hops[hops.length - 1]));
    }

    /**
     * Content of a string literal written directly in place. A call such as
     * {@code os.Getenv("X")} is not a literal, whatever its argument.
     */
    public static Optional<String> stringLiteral(Expr expr) {
        if (expr instanceof BasicLit literal && literal.isString()) {
            return Optional.of(literal.stringValue());
        }
        return Optional.empty();
    }

    /**
     * Integer literal value, looking through one pointer wrapper and one conversion as in
     * {@code ptr(int32(3))}; {@link #UNSET} when there is none.
     */
    public static long intLiteral(Expr expr) {
        Expr unwrapped = unwrapScalar(expr);
        if (unwrapped instanceof BasicLit literal && literal.kind() == BasicLit.Kind.INT) {
            try {
                return Long.decode(literal.value().replace("_", "").replaceFirst("^0[oO]", "0"));
            } catch (NumberFormatException e) {
                return UNSET;
            }
        }
        return UNSET;
    }

    /**
     * True only for a literal {@code true}, possibly wrapped in a pointer helper such as {@code ptr(true)}.
     */
    public static boolean boolLiteral(Expr expr) {
        return unwrapScalar(expr) instanceof Ident ident && "true".equals(ident.name());
    }

    /**
     * String-to-string pairs of a map literal. A map given by anything other than a
     * literal (a shared variable, a function result) yields an empty map; references
     * are not resolved.
     */
    public static Map<String, String> mapLiteral(Expr expr) {
        Optional<CompositeLit> literal = nestedRecord(expr);
        if (literal.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> pairs = new LinkedHashMap<>();
        for (Expr element : literal.get().elements()) {
            if (element instanceof KeyValueExpr keyValue) {
                Optional<String> key = stringLiteral(keyValue.key());
                Optional<String> value = stringLiteral(keyValue.value());
                if (key.isPresent() && value.isPresent()) {
                    pairs.put(key.get(), value.get());
                }
            }
        }
        return pairs;
    }

    /**
     * Element count of a slice, array or map literal; zero when {@code expr} is not a literal.
     */
    public static int elementCount(Expr expr) {
        return nestedRecord(expr).map(literal -> literal.elements().size()).orElse(0);
    }

    static boolean hopMatches(String hop, String key) {
        if (hop.indexOf('|') < 0) {
            return hop.equals(key);
        }
        for (String alternative : hop.split("\\|")) {
            if (alternative.equals(key)) {
                return true;
            }
        }
        return false;
    }

    private static String typeName(Expr type) {
        if (type instanceof Ident ident) {
            return ident.name();
        }
        if (type instanceof SelectorExpr selector) {
            return selector.field();
        }
        return null;
    }

    // At most one pointer wrapper (ptr(x), pointer.Int32(x), &x) around at most one conversion (int32(x)).
    private static Expr unwrapScalar(Expr expr) {
        Expr current = expr;
        if (current instanceof UnaryExpr unary && unary.isAddressOf()) {
            current = unary.operand();
        } else if (current instanceof CallExpr call && call.arguments().size() == 1
                && isPointerHelper(call.function())) {
            current = call.arguments().get(0);
        }
        if (current instanceof CallExpr call && call.arguments().size() == 1
                && call.function() instanceof Ident type && CONVERSIONS.contains(type.name())) {
            current = call.arguments().get(0);
        }
        return current;
    }

    /**
     * {@code ptr}, {@code boolPtr}, {@code ptrInt32}, {@code pointer.Int32}, {@code ptr.To}, {@code to.Ptr}.
     */
    static boolean isPointerHelper(Expr function) {
        if (function instanceof Ident ident) {
            return isPointerName(ident.name());
        }
        if (function instanceof SelectorExpr selector) {
            boolean pointerPackage = selector.operand() instanceof Ident pkg
                    && (pkg.name().equals("pointer") || pkg.name().equals("ptr"));
            return pointerPackage || isPointerName(selector.field());
        }
        return false;
    }

    private static boolean isPointerName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.startsWith("ptr") || lower.endsWith("ptr") || lower.equals("pointer");
    }
}
