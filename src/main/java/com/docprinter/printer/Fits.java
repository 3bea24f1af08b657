package com.docprinter.printer;

import com.docprinter.doc.Concat;
import com.docprinter.doc.Doc;
import com.docprinter.doc.Fill;
import com.docprinter.doc.GroupId;
import com.docprinter.doc.Group;
import com.docprinter.doc.IfBreak;
import com.docprinter.doc.Indent;
import com.docprinter.doc.Line;
import com.docprinter.doc.Text;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The fit-check: measures a command rendered in its mode, followed by the pending
 * commands, until the first line that will break or the end of the document.
 */
final class Fits {

    private Fits() {
    }

    /**
     * @param next        the candidate, normally in flat mode
     * @param rest        commands still to be printed after {@code next}, top of stack first
     * @param width       columns left on the current line
     * @param tabWidth    columns taken by a tab in text
     * @param groupModes  modes of groups already printed
     * @param broken      groups that must break
     * @param mustBeFlat  fail as soon as a group that must break is met
     */
    static boolean fits(Command next,
                        Iterable<Command> rest,
                        int width,
                        int tabWidth,
                        Map<GroupId, PrintMode> groupModes,
                        Set<Group> broken,
                        boolean mustBeFlat) {
        Iterator<Command> restCommands = rest.iterator();
        Deque<Command> commands = new ArrayDeque<>();
        commands.push(next);
        boolean inRest = false;
        int trailingWhitespace = 0;

        while (width >= 0) {
            if (commands.isEmpty()) {
                if (!restCommands.hasNext()) {
                    return true;
                }
                commands.push(restCommands.next());
                inRest = true;
                continue;
            }

            Command command = commands.pop();
            PrintMode mode = command.mode();
            Doc doc = command.doc();
            switch (doc.kind()) {
                case TEXT -> {
                    String value = ((Text) doc).value();
                    width -= StringWidth.of(value, tabWidth);
                    trailingWhitespace = trailingWhitespace(value, trailingWhitespace, tabWidth);
                }
                case CONCAT -> pushAll(commands, command, ((Concat) doc).parts(), 0);
                case FILL -> pushAll(commands, command, ((Fill) doc).parts(), command.fillOffset());
                case INDENT -> commands.push(new Command(command.indentation(), mode, ((Indent) doc).contents(), command.depth()));
                case TRIM -> {
                    width += trailingWhitespace;
                    trailingWhitespace = 0;
                }
                case GROUP -> {
                    Group group = (Group) doc;
                    boolean mustBreak = group.shouldBreak() || broken.contains(group);
                    if (mustBeFlat && mustBreak) {
                        return false;
                    }
                    PrintMode groupMode = mustBreak ? PrintMode.BREAK : mode;
                    commands.push(new Command(command.indentation(), groupMode, group.contents(), command.depth()));
                }
                case IF_BREAK -> {
                    IfBreak ifBreak = (IfBreak) doc;
                    PrintMode groupMode = ifBreak.groupId() != null
                            ? groupModes.getOrDefault(ifBreak.groupId(), PrintMode.FLAT)
                            : mode;
                    Doc contents = groupMode == PrintMode.BREAK ? ifBreak.breakContents() : ifBreak.flatContents();
                    commands.push(new Command(command.indentation(), mode, contents, command.depth()));
                }
                case LINE -> {
                    Line line = (Line) doc;
                    if (mode == PrintMode.BREAK) {
                        return true;
                    }
                    switch (line.lineKind()) {
                        case SOFT -> {
                            width--;
                            trailingWhitespace++;
                        }
                        case SOFT_EMPTY -> {
                        }
                        case HARD, LITERAL -> {
                            // a flat run can never contain a forced newline
                            return false;
                        }
                    }
                }
                case BREAK_PARENT -> {
                    if (!inRest && mode == PrintMode.FLAT) {
                        return false;
                    }
                }
                case LINE_SUFFIX -> {
                    // invisible until flushed
                }
            }
        }
        return false;
    }

    private static void pushAll(Deque<Command> commands, Command parent, List<Doc> parts, int from) {
        for (int i = parts.size() - 1; i >= from; i--) {
            commands.push(new Command(parent.indentation(), parent.mode(), parts.get(i), parent.depth()));
        }
    }

    /**
     * Width of the spaces and tabs ending the line so far, which a trim would give back.
     */
    private static int trailingWhitespace(String value, int previous, int tabWidth) {
        int width = 0;
        for (int i = value.length() - 1; i >= 0; i--) {
            char c = value.charAt(i);
            if (c != ' ' && c != '\t') {
                return width;
            }
            width += c == '\t' ? tabWidth : 1;
        }
        return previous + width;
    }
}
