package com.vidnyan.k8slint.adapter.out.parser;

import com.vidnyan.k8slint.domain.ast.BasicLit;
import com.vidnyan.k8slint.domain.ast.CallExpr;
import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.ast.Decl;
import com.vidnyan.k8slint.domain.ast.Expr;
import com.vidnyan.k8slint.domain.ast.FuncDecl;
import com.vidnyan.k8slint.domain.ast.GenDecl;
import com.vidnyan.k8slint.domain.ast.Ident;
import com.vidnyan.k8slint.domain.ast.KeyValueExpr;
import com.vidnyan.k8slint.domain.ast.OpaqueDecl;
import com.vidnyan.k8slint.domain.ast.OpaqueExpr;
import com.vidnyan.k8slint.domain.ast.SelectorExpr;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.ast.Span;
import com.vidnyan.k8slint.domain.ast.TypeExpr;
import com.vidnyan.k8slint.domain.ast.UnaryExpr;
import com.vidnyan.k8slint.domain.ast.ValueSpec;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts one tree-sitter-go tree. Tree-sitter reports UTF-8 byte offsets; spans are
 * translated to char offsets so the printer can slice the Java string directly.
 */
final class GoTreeConverter {

    private static final String COMMENT = "comment";

    private final String path;
    private final String source;
    private final int[] charIndex;

    GoTreeConverter(String path, String source) {
        this.path = path;
        this.source = source;
        this.charIndex = byteToCharIndex(source);
    }

    SourceFile convert(TSNode root) {
        String packageName = null;
        List<Decl> decls = new ArrayList<>();
        int docStart = -1;
        int docEndRow = -2;
        int lastCodeEndRow = -1;
        for (int i = 0; i < root.getNamedChildCount(); i++) {
            TSNode child = root.getNamedChild(i);
            String type = child.getType();
            int startRow = child.getStartPoint().getRow();
            if (COMMENT.equals(type)) {
                if (startRow == lastCodeEndRow) {
                    continue;
                }
                if (docStart < 0 || startRow > docEndRow + 1) {
                    docStart = start(child);
                }
                docEndRow = child.getEndPoint().getRow();
                continue;
            }
            int leading = docStart >= 0 && docEndRow + 1 >= startRow ? docStart : start(child);
            docStart = -1;
            lastCodeEndRow = child.getEndPoint().getRow();

            switch (type) {
                case "package_clause" -> packageName = packageName(child);
                case "var_declaration" -> decls.add(genDecl(child, GenDecl.Keyword.VAR, leading));
                case "const_declaration" -> decls.add(genDecl(child, GenDecl.Keyword.CONST, leading));
                case "function_declaration", "method_declaration" -> decls.add(funcDecl(child, leading));
                default -> decls.add(new OpaqueDecl(type, span(child), leading));
            }
        }
        return new SourceFile(path, packageName, source, decls);
    }

    private String packageName(TSNode clause) {
        for (int i = 0; i < clause.getNamedChildCount(); i++) {
            TSNode child = clause.getNamedChild(i);
            if (!COMMENT.equals(child.getType())) {
                return text(child);
            }
        }
        return null;
    }

    private GenDecl genDecl(TSNode node, GenDecl.Keyword keyword, int leading) {
        List<ValueSpec> specs = new ArrayList<>();
        collectSpecs(node, specs);
        return new GenDecl(keyword, specs, span(node), leading, false);
    }

    // Grouped specs sit directly under the declaration or inside a spec list, depending on grammar version.
    private void collectSpecs(TSNode node, List<ValueSpec> specs) {
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            switch (child.getType()) {
                case "var_spec", "const_spec" -> specs.add(valueSpec(child));
                case "var_spec_list", "const_spec_list" -> collectSpecs(child, specs);
                default -> {
                }
            }
        }
    }

    private ValueSpec valueSpec(TSNode spec) {
        List<Ident> names = new ArrayList<>();
        Expr type = null;
        List<Expr> values = new ArrayList<>();
        boolean afterEquals = false;
        for (int i = 0; i < spec.getChildCount(); i++) {
            TSNode child = spec.getChild(i);
            String kind = child.getType();
            if ("=".equals(kind)) {
                afterEquals = true;
            } else if (!child.isNamed() || COMMENT.equals(kind)) {
                continue;
            } else if (afterEquals) {
                if ("expression_list".equals(kind)) {
                    values.addAll(namedChildren(child));
                } else {
                    values.add(expr(child));
                }
            } else if ("identifier".equals(kind)) {
                names.add(Ident.of(text(child), span(child)));
            } else {
                type = expr(child);
            }
        }
        return new ValueSpec(names, type, values, span(spec), false);
    }

    private FuncDecl funcDecl(TSNode node, int leading) {
        TSNode name = field(node, "name");
        TSNode body = field(node, "body");
        return new FuncDecl(name == null ? null : text(name), body == null ? null : expr(body), span(node), leading);
    }

    private Expr expr(TSNode node) {
        String kind = node.getType();
        return switch (kind) {
            case "identifier", "field_identifier", "type_identifier", "package_identifier",
                    "true", "false", "nil", "iota" -> Ident.of(text(node), span(node));
            case "interpreted_string_literal", "raw_string_literal" -> literal(node, BasicLit.Kind.STRING);
            case "int_literal" -> literal(node, BasicLit.Kind.INT);
            case "float_literal" -> literal(node, BasicLit.Kind.FLOAT);
            case "imaginary_literal" -> literal(node, BasicLit.Kind.IMAG);
            case "rune_literal" -> literal(node, BasicLit.Kind.CHAR);
            case "composite_literal" -> compositeLiteral(node);
            case "literal_value" -> elidedLiteral(node, null);
            case "literal_element" -> element(node, null);
            case "keyed_element" -> keyedElement(node, null);
            case "unary_expression" -> unary(node);
            case "call_expression" -> call(node);
            case "selector_expression" -> new SelectorExpr(
                    expr(field(node, "operand")), text(field(node, "field")), span(node));
            case "qualified_type" -> {
                TSNode pkg = field(node, "package");
                yield new SelectorExpr(Ident.of(text(pkg), span(pkg)), text(field(node, "name")), span(node));
            }
            case "slice_type" -> typeExpr(node, TypeExpr.Kind.SLICE, field(node, "element"));
            case "array_type", "implicit_length_array_type" ->
                    typeExpr(node, TypeExpr.Kind.ARRAY, field(node, "element"));
            case "map_type" -> typeExpr(node, TypeExpr.Kind.MAP, field(node, "value"));
            case "pointer_type" -> typeExpr(node, TypeExpr.Kind.POINTER, firstNamed(node));
            default -> new OpaqueExpr(kind, namedChildren(node), span(node));
        };
    }

    private BasicLit literal(TSNode node, BasicLit.Kind kind) {
        return BasicLit.of(kind, text(node), span(node));
    }

    private TypeExpr typeExpr(TSNode node, TypeExpr.Kind kind, TSNode element) {
        List<Expr> parts = namedChildren(node);
        Expr elementExpr = null;
        if (element != null) {
            int start = start(element);
            elementExpr = parts.stream().filter(p -> p.span().start() == start).findFirst().orElse(null);
        }
        return new TypeExpr(kind, elementExpr, parts, span(node));
    }

    private CompositeLit compositeLiteral(TSNode node) {
        TSNode typeNode = field(node, "type");
        Expr type = typeNode == null ? null : expr(typeNode);
        return new CompositeLit(type, null, false, elements(field(node, "body"), type), span(node));
    }

    // {...} whose type comes from the enclosing slice, array or map literal.
    private CompositeLit elidedLiteral(TSNode literalValue, Expr enclosingType) {
        Expr implied = elementType(enclosingType);
        boolean pointer = false;
        if (implied instanceof TypeExpr typeExpr && typeExpr.kind() == TypeExpr.Kind.POINTER) {
            implied = typeExpr.element();
            pointer = true;
        }
        return new CompositeLit(null, implied, pointer, elements(literalValue, implied), span(literalValue));
    }

    private static Expr elementType(Expr type) {
        if (type instanceof TypeExpr typeExpr && typeExpr.kind() != TypeExpr.Kind.POINTER
                && typeExpr.kind() != TypeExpr.Kind.OTHER) {
            return typeExpr.element();
        }
        return null;
    }

    private List<Expr> elements(TSNode body, Expr ownType) {
        List<Expr> elements = new ArrayList<>();
        if (body == null) {
            return elements;
        }
        for (int i = 0; i < body.getNamedChildCount(); i++) {
            TSNode child = body.getNamedChild(i);
            switch (child.getType()) {
                case COMMENT -> {
                }
                case "keyed_element" -> elements.add(keyedElement(child, ownType));
                case "literal_element" -> elements.add(element(child, ownType));
                case "literal_value" -> elements.add(elidedLiteral(child, ownType));
                default -> elements.add(expr(child));
            }
        }
        return elements;
    }

    private Expr element(TSNode node, Expr enclosingType) {
        if (!"literal_element".equals(node.getType())) {
            return "literal_value".equals(node.getType()) ? elidedLiteral(node, enclosingType) : expr(node);
        }
        TSNode inner = firstNamed(node);
        if (inner == null) {
            return new OpaqueExpr(node.getType(), List.of(), span(node));
        }
        return element(inner, enclosingType);
    }

    private KeyValueExpr keyedElement(TSNode node, Expr enclosingType) {
        List<TSNode> parts = new ArrayList<>();
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if (!COMMENT.equals(child.getType())) {
                parts.add(child);
            }
        }
        Expr key = element(parts.get(0), null);
        Expr value = element(parts.get(parts.size() - 1), enclosingType);
        return KeyValueExpr.of(key, value, span(node));
    }

    private UnaryExpr unary(TSNode node) {
        TSNode operator = field(node, "operator");
        String op = operator != null ? text(operator) : text(node.getChild(0));
        return UnaryExpr.of(op, expr(field(node, "operand")), span(node));
    }

    private CallExpr call(TSNode node) {
        TSNode arguments = field(node, "arguments");
        return new CallExpr(expr(field(node, "function")),
                arguments == null ? List.of() : namedChildren(arguments), span(node));
    }

    private List<Expr> namedChildren(TSNode node) {
        List<Expr> children = new ArrayList<>();
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if (!COMMENT.equals(child.getType())) {
                children.add(expr(child));
            }
        }
        return children;
    }

    private static TSNode field(TSNode node, String name) {
        TSNode child = node.getChildByFieldName(name);
        return child == null || child.isNull() ? null : child;
    }

    private static TSNode firstNamed(TSNode node) {
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if (!COMMENT.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    private int start(TSNode node) {
        return charIndex[node.getStartByte()];
    }

    private Span span(TSNode node) {
        return new Span(charIndex[node.getStartByte()], charIndex[node.getEndByte()],
                node.getStartPoint().getRow() + 1, node.getStartPoint().getColumn() + 1);
    }

    private String text(TSNode node) {
        return source.substring(charIndex[node.getStartByte()], charIndex[node.getEndByte()]);
    }

    /**
     * Maps every UTF-8 byte offset of {@code source} to the index of the char it belongs to.
     */
    static int[] byteToCharIndex(String source) {
        int[] index = new int[utf8Length(source) + 1];
        int offset = 0;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            int width;
            if (c < 0x80) {
                width = 1;
            } else if (c < 0x800) {
                width = 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < source.length()
                    && Character.isLowSurrogate(source.charAt(i + 1))) {
                width = 4;
            } else {
                width = 3;
            }
            for (int b = 0; b < width; b++) {
                index[offset + b] = i;
            }
            offset += width;
            if (width == 4) {
                i++;
            }
        }
        index[offset] = source.length();
        return index;
    }

    private static int utf8Length(String source) {
        int length = 0;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c < 0x80) {
                length += 1;
            } else if (c < 0x800) {
                length += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < source.length()
                    && Character.isLowSurrogate(source.charAt(i + 1))) {
                length += 4;
                i++;
            } else {
                length += 3;
            }
        }
        return length;
    }
}
