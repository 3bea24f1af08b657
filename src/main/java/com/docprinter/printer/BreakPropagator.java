package com.docprinter.printer;

import com.docprinter.doc.Concat;
import com.docprinter.doc.Doc;
import com.docprinter.doc.Fill;
import com.docprinter.doc.Group;
import com.docprinter.doc.IfBreak;
import com.docprinter.doc.Indent;
import com.docprinter.doc.Line;
import com.docprinter.doc.LineSuffix;
import com.docprinter.doc.RecursionTooDeepException;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Finds the groups that must print in break mode whatever the width: those that
 * ask for it, those containing a hard or literal line or a {@code BreakParent},
 * and every ancestor of such a group.
 *
 * <p>Groups are tracked by identity; documents are immutable so the result is
 * kept on the side instead of being written into the tree.
 */
final class BreakPropagator {

    private BreakPropagator() {
    }

    private record Frame(Doc doc, int depth, boolean exit) {
    }

    static Set<Group> findBrokenGroups(Doc root, int maxDepth) {
        Set<Group> broken = Collections.newSetFromMap(new IdentityHashMap<>());
        Set<Group> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Group> enclosing = new ArrayDeque<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, 0, false));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            if (frame.exit()) {
                Group group = enclosing.pop();
                if (broken.contains(group)) {
                    breakEnclosing(enclosing, broken);
                }
                continue;
            }

            Doc doc = frame.doc();
            int childDepth = frame.depth() + 1;
            switch (doc.kind()) {
                case TEXT, TRIM -> {
                }
                case BREAK_PARENT -> breakEnclosing(enclosing, broken);
                case LINE -> {
                    if (((Line) doc).isUnconditional()) {
                        breakEnclosing(enclosing, broken);
                    }
                }
                case CONCAT -> pushAll(stack, ((Concat) doc).parts(), childDepth, maxDepth);
                case FILL -> pushAll(stack, ((Fill) doc).parts(), childDepth, maxDepth);
                case INDENT -> push(stack, ((Indent) doc).contents(), childDepth, maxDepth);
                case LINE_SUFFIX -> push(stack, ((LineSuffix) doc).contents(), childDepth, maxDepth);
                case IF_BREAK -> {
                    IfBreak ifBreak = (IfBreak) doc;
                    push(stack, ifBreak.flatContents(), childDepth, maxDepth);
                    push(stack, ifBreak.breakContents(), childDepth, maxDepth);
                }
                case GROUP -> {
                    Group group = (Group) doc;
                    if (!visited.add(group)) {
                        // shared subtree, already measured
                        if (broken.contains(group)) {
                            breakEnclosing(enclosing, broken);
                        }
                        continue;
                    }
                    if (group.shouldBreak()) {
                        broken.add(group);
                    }
                    enclosing.push(group);
                    stack.push(new Frame(group, frame.depth(), true));
                    push(stack, group.contents(), childDepth, maxDepth);
                }
            }
        }
        return broken;
    }

    private static void breakEnclosing(Deque<Group> enclosing, Set<Group> broken) {
        Group parent = enclosing.peek();
        if (parent != null) {
            broken.add(parent);
        }
    }

    private static void push(Deque<Frame> stack, Doc doc, int depth, int maxDepth) {
        stack.push(new Frame(doc, RecursionTooDeepException.check(depth, maxDepth), false));
    }

    private static void pushAll(Deque<Frame> stack, List<Doc> parts, int depth, int maxDepth) {
        for (int i = parts.size() - 1; i >= 0; i--) {
            push(stack, parts.get(i), depth, maxDepth);
        }
    }
}
