package com.docprinter.core;

import static com.docprinter.doc.Docs.concat;
import static com.docprinter.doc.Docs.group;
import static com.docprinter.doc.Docs.hardLine;
import static com.docprinter.doc.Docs.indent;
import static com.docprinter.doc.Docs.join;
import static com.docprinter.doc.Docs.line;
import static com.docprinter.doc.Docs.softLine;
import static com.docprinter.doc.Docs.text;

import com.docprinter.api.FormatterPlugin;
import com.docprinter.api.ParsedSource;
import com.docprinter.api.error.FormatterError;
import com.docprinter.api.error.Severity;
import com.docprinter.doc.Doc;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Parenthesised lists of atoms, one form per line. Each list is a group that
 * breaks its elements onto indented lines when it does not fit.
 */
class ListSyntaxPlugin implements FormatterPlugin<List<ListSyntaxPlugin.Node>> {

    record Node(String atom, List<Node> children) {
        boolean isAtom() {
            return atom != null;
        }
    }

    @Override
    public ParsedSource<List<Node>> parse(String sourceCode) {
        List<FormatterError> diagnostics = new ArrayList<>();
        Deque<List<Node>> open = new ArrayDeque<>();
        open.push(new ArrayList<>());
        int line = 1;
        int column = 0;
        int i = 0;

        while (i < sourceCode.length()) {
            char c = sourceCode.charAt(i);
            column++;
            if (c == '\n') {
                line++;
                column = 0;
                i++;
            } else if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                open.push(new ArrayList<>());
                i++;
            } else if (c == ')') {
                if (open.size() == 1) {
                    diagnostics.add(new FormatterError(Severity.ERROR, "Unexpected ')'", line, column));
                } else {
                    List<Node> children = open.pop();
                    open.peek().add(new Node(null, children));
                }
                i++;
            } else {
                int start = i;
                while (i < sourceCode.length() && !Character.isWhitespace(sourceCode.charAt(i))
                        && sourceCode.charAt(i) != '(' && sourceCode.charAt(i) != ')') {
                    i++;
                }
                column += i - start - 1;
                open.peek().add(new Node(sourceCode.substring(start, i), null));
            }
        }

        if (open.size() > 1) {
            diagnostics.add(new FormatterError(Severity.ERROR, "Missing ')'", line, column, "Close every list"));
        }
        return new ParsedSource<>(open.getLast(), diagnostics);
    }

    @Override
    public Doc toDoc(List<Node> forms) {
        List<Doc> docs = new ArrayList<>();
        for (Node form : forms) {
            docs.add(nodeDoc(form));
        }
        return concat(join(hardLine(), docs), hardLine());
    }

    private static Doc nodeDoc(Node node) {
        if (node.isAtom()) {
            return text(node.atom());
        }
        List<Doc> children = new ArrayList<>();
        for (Node child : node.children()) {
            children.add(nodeDoc(child));
        }
        return group(text("("), indent(softLine(), join(line(), children)), softLine(), text(")"));
    }
}
