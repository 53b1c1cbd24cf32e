package com.vidnyan.k8slint.domain.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Serializes a (possibly rewritten) tree back to Go source.
 * <p>
 * Text that no fix touched is copied from the original source, comments and layout
 * included; only synthetic nodes are printed from structure. A tree without synthetic
 * nodes prints back byte for byte.
 */
public final class SourcePrinter {

    public String print(SourceFile file) {
        String source = file.source();
        StringBuilder out = new StringBuilder(source.length() + 256);
        Emitter emitter = new Emitter(source, out);
        List<GenDecl> pending = new ArrayList<>();
        int cursor = 0;
        for (Decl decl : file.decls()) {
            if (decl instanceof GenDecl gen && gen.synthetic()) {
                pending.add(gen);
                continue;
            }
            if (!pending.isEmpty()) {
                out.append(source, cursor, decl.leadingStart());
                for (GenDecl hoisted : pending) {
                    out.append(renderHoisted(source, hoisted)).append("\n\n");
                }
                pending.clear();
                cursor = decl.leadingStart();
            }
            out.append(source, cursor, decl.span().start());
            emitter.emit(decl);
            cursor = decl.span().end();
        }
        out.append(source, cursor, source.length());
        if (!pending.isEmpty()) {
            if (out.length() > 0 && out.charAt(out.length() - 1) != '\n') {
                out.append('\n');
            }
            for (GenDecl hoisted : pending) {
                out.append('\n').append(renderHoisted(source, hoisted)).append('\n');
            }
        }
        return out.toString();
    }

    private String renderHoisted(String source, GenDecl decl) {
        ValueSpec spec = decl.specs().get(0);
        Expr value = spec.values().get(0);
        StringBuilder text = new StringBuilder();
        new Emitter(source, text).emit(value);

        Expr anchored = value;
        while (anchored.span() == null && anchored instanceof UnaryExpr unary) {
            anchored = unary.operand();
        }
        String body = anchored.span() == null
                ? text.toString()
                : dedent(text.toString(), indentOf(source, anchored.span().start()));
        return "var " + spec.names().get(0).name() + " = " + body;
    }

    static String indentOf(String source, int offset) {
        int lineStart = source.lastIndexOf('\n', offset - 1) + 1;
        int end = lineStart;
        while (end < source.length() && (source.charAt(end) == ' ' || source.charAt(end) == '\t')) {
            end++;
        }
        return source.substring(lineStart, Math.min(end, Math.max(offset, lineStart)));
    }

    // Continuation lines lose the indentation the value had at its original depth.
    private static String dedent(String text, String indent) {
        if (indent.isEmpty() || text.indexOf('\n') < 0) {
            return text;
        }
        String[] lines = text.split("\n", -1);
        StringBuilder out = new StringBuilder(text.length());
        out.append(lines[0]);
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            out.append('\n');
            if (line.startsWith(indent)) {
                out.append(line, indent.length(), line.length());
            } else if (!line.isBlank()) {
                out.append(line);
            }
        }
        return out.toString();
    }

    private static final class Emitter implements ExprVisitor<Void> {

        private final String source;
        private final StringBuilder out;

        Emitter(String source, StringBuilder out) {
            this.source = source;
            this.out = out;
        }

        void emit(Node node) {
            if (node instanceof Expr expr) {
                expr.accept(this);
            } else if (node instanceof GenDecl gen) {
                splice(gen.span(), gen.specs());
            } else if (node instanceof ValueSpec spec) {
                List<Node> parts = new ArrayList<>(spec.names());
                if (spec.type() != null) {
                    parts.add(spec.type());
                }
                parts.addAll(spec.values());
                splice(spec.span(), parts);
            } else if (node instanceof FuncDecl func) {
                splice(func.span(), func.body() == null ? List.of() : List.of(func.body()));
            } else if (node instanceof OpaqueDecl opaque) {
                copy(opaque.span().start(), opaque.span().end());
            }
        }

        private void splice(Span span, List<? extends Node> children) {
            int cursor = span.start();
            for (Node child : children) {
                Span slot = child.span();
                if (slot == null) {
                    continue;
                }
                copy(cursor, slot.start());
                emit(child);
                cursor = slot.end();
            }
            copy(cursor, span.end());
        }

        private void copy(int from, int to) {
            out.append(source, from, to);
        }

        private void leaf(Node node, String text) {
            if (node.synthetic()) {
                out.append(text);
            } else {
                copy(node.span().start(), node.span().end());
            }
        }

        @Override
        public Void visitIdent(Ident ident) {
            leaf(ident, ident.name());
            return null;
        }

        @Override
        public Void visitBasicLit(BasicLit literal) {
            leaf(literal, literal.value());
            return null;
        }

        @Override
        public Void visitKeyValue(KeyValueExpr keyValue) {
            if (keyValue.span() == null) {
                emit(keyValue.key());
                out.append(": ");
                emit(keyValue.value());
            } else {
                splice(keyValue.span(), keyValue.children());
            }
            return null;
        }

        @Override
        public Void visitUnary(UnaryExpr unary) {
            if (unary.span() == null) {
                out.append(unary.operator());
                emit(unary.operand());
            } else {
                splice(unary.span(), unary.children());
            }
            return null;
        }

        @Override
        public Void visitCall(CallExpr call) {
            splice(call.span(), call.children());
            return null;
        }

        @Override
        public Void visitSelector(SelectorExpr selector) {
            splice(selector.span(), selector.children());
            return null;
        }

        @Override
        public Void visitType(TypeExpr type) {
            splice(type.span(), type.children());
            return null;
        }

        @Override
        public Void visitOpaque(OpaqueExpr opaque) {
            splice(opaque.span(), opaque.children());
            return null;
        }

        @Override
        public Void visitCompositeLit(CompositeLit literal) {
            Span span = literal.span();
            int cursor = span.start();
            Expr type = literal.type();
            if (type != null) {
                if (span.encloses(type.span())) {
                    copy(cursor, type.span().start());
                    emit(type);
                    cursor = type.span().end();
                } else {
                    emit(type);
                }
            }

            List<Expr> elements = literal.elements();
            Expr anchor = null;
            for (int i = 0; i < elements.size(); i++) {
                Expr element = elements.get(i);
                if (element.span() != null) {
                    copy(cursor, element.span().start());
                    emit(element);
                    cursor = element.span().end();
                    anchor = element;
                } else if (anchor == null) {
                    int afterBrace = source.indexOf('{', cursor) + 1;
                    copy(cursor, afterBrace);
                    cursor = afterBrace;
                    emit(element);
                    if (i < elements.size() - 1) {
                        out.append(", ");
                    }
                } else {
                    cursor = insertAfter(anchor, element, cursor, nextSpannedStart(elements, i, span.end()));
                }
            }
            copy(cursor, span.end());
            return null;
        }

        // Multi-line literals get the element on its own line with the anchor's indentation.
        private int insertAfter(Expr anchor, Expr element, int cursor, int limit) {
            int anchorEnd = anchor.span().end();
            int newline = source.indexOf('\n', anchorEnd);
            if (newline >= 0 && newline < limit) {
                copy(cursor, newline);
                out.append('\n').append(indentOf(source, anchor.span().start()));
                emit(element);
                out.append(',');
                return newline;
            }
            copy(cursor, anchorEnd);
            out.append(", ");
            emit(element);
            return Math.max(cursor, anchorEnd);
        }

        private static int nextSpannedStart(List<Expr> elements, int from, int fallback) {
            for (int i = from + 1; i < elements.size(); i++) {
                if (elements.get(i).span() != null) {
                    return elements.get(i).span().start();
                }
            }
            return fallback;
        }
    }
}
