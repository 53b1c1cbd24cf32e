package com.vidnyan.k8slint.domain.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A parsed Go file.
 * <p>
 * Each parse yields a tree owned by its caller. Analysis only reads it; the fix pass
 * parses its own copy, mutates it and hands it to {@link SourcePrinter}, so no tree is
 * ever read by one pass while another mutates it.
 */
public final class SourceFile {

    private final String path;
    private final String packageName;
    private final String source;
    private final List<Decl> decls;

    public SourceFile(String path, String packageName, String source, List<Decl> decls) {
        this.path = path;
        this.packageName = packageName;
        this.source = source;
        this.decls = new ArrayList<>(decls);
    }

    /**
     * Path as reported in issues.
     */
    public String path() {
        return path;
    }

    public String packageName() {
        return packageName;
    }

    public String source() {
        return source;
    }

    public List<Decl> decls() {
        return Collections.unmodifiableList(decls);
    }

    public String text(Span span) {
        return source.substring(span.start(), span.end());
    }

    /**
     * Package-level var bindings that have an initializer, in declaration order.
     */
    public List<TopLevelVar> topLevelVars() {
        List<TopLevelVar> vars = new ArrayList<>();
        for (Decl decl : decls) {
            if (!(decl instanceof GenDecl gen) || gen.keyword() != GenDecl.Keyword.VAR) {
                continue;
            }
            for (ValueSpec spec : gen.specs()) {
                List<Ident> names = spec.names();
                for (int i = 0; i < names.size() && i < spec.values().size(); i++) {
                    if (!names.get(i).isBlank()) {
                        vars.add(new TopLevelVar(names.get(i), spec.values().get(i), spec, i));
                    }
                }
            }
        }
        return vars;
    }

    /**
     * Every name declared at package level, including constants and functions.
     */
    public Set<String> topLevelNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Decl decl : decls) {
            if (decl instanceof GenDecl gen) {
                gen.specs().forEach(spec -> spec.names().forEach(name -> names.add(name.name())));
            } else if (decl instanceof FuncDecl func && func.name() != null) {
                names.add(func.name());
            }
        }
        return names;
    }

    /**
     * Inserts {@code hoisted} in order in front of the first var declaration, or at the
     * end of the file when there is none.
     */
    public void insertBeforeFirstVar(List<? extends Decl> hoisted) {
        int index = decls.size();
        for (int i = 0; i < decls.size(); i++) {
            if (decls.get(i) instanceof GenDecl gen && gen.keyword() == GenDecl.Keyword.VAR && !gen.synthetic()) {
                index = i;
                break;
            }
        }
        decls.addAll(index, hoisted);
    }
}
