package com.docprinter.printer;

import com.docprinter.config.LayoutConfig;
import com.docprinter.doc.Concat;
import com.docprinter.doc.Doc;
import com.docprinter.doc.Fill;
import com.docprinter.doc.Group;
import com.docprinter.doc.GroupId;
import com.docprinter.doc.IfBreak;
import com.docprinter.doc.Indent;
import com.docprinter.doc.Line;
import com.docprinter.doc.LineKind;
import com.docprinter.doc.LineSuffix;
import com.docprinter.doc.RecursionTooDeepException;
import com.docprinter.doc.Text;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders a {@link Doc} into text under a {@link LayoutConfig}.
 *
 * <p>Printing is a single depth-first pass over an explicit command stack. Each
 * command pairs a document with the indentation and mode it inherits. A group's
 * mode is decided once, when its command is popped: break if it has to, flat if
 * its contents and everything up to the next possible line break fit in the
 * remaining width, break otherwise.
 *
 * <p>An instance holds the render state of a single call and is not reused; the
 * static {@code print} methods are safe to call concurrently.
 */
public final class DocPrinter {
    private static final List<Command> NO_COMMANDS = List.of();

    private final LayoutConfig config;
    private final int startColumn;
    private final int maxDepth;
    private final StringBuilder output = new StringBuilder();
    private final Deque<Command> commands = new ArrayDeque<>();
    private final List<Command> lineSuffixes = new ArrayList<>();
    private final Map<GroupId, PrintMode> groupModes = new HashMap<>();
    private Set<Group> brokenGroups;
    private int position;
    private boolean shouldRemeasure;

    private DocPrinter(LayoutConfig config, int startColumn) {
        this.config = config;
        this.startColumn = startColumn;
        this.maxDepth = config.getMaxDepth();
        this.position = startColumn;
    }

    public static String print(Doc doc, LayoutConfig config) {
        return print(doc, config, 0);
    }

    /**
     * Prints {@code doc} as if the first line already had {@code startColumn} columns written.
     *
     * @throws RecursionTooDeepException if the document is nested deeper than
     *                                   {@link LayoutConfig#getMaxDepth()}
     */
    public static String print(Doc doc, LayoutConfig config, int startColumn) {
        if (startColumn < 0) {
            throw new IllegalArgumentException("startColumn must not be negative: " + startColumn);
        }
        return new DocPrinter(config, startColumn).run(doc);
    }

    private String run(Doc doc) {
        brokenGroups = BreakPropagator.findBrokenGroups(doc, maxDepth);
        commands.push(new Command(Indentation.ROOT, PrintMode.BREAK, doc, 0));

        while (!commands.isEmpty()) {
            process(commands.pop());

            if (commands.isEmpty() && !lineSuffixes.isEmpty()) {
                pushLineSuffixes();
            }
        }
        return output.toString();
    }

    private void process(Command command) {
        Doc doc = command.doc();
        switch (doc.kind()) {
            case TEXT -> {
                String value = ((Text) doc).value();
                output.append(value);
                position += StringWidth.of(value, config.getTabWidth());
            }
            case CONCAT -> {
                List<Doc> parts = ((Concat) doc).parts();
                for (int i = parts.size() - 1; i >= 0; i--) {
                    commands.push(command.child(parts.get(i), maxDepth));
                }
            }
            case INDENT -> commands.push(new Command(
                    command.indentation().increase(config),
                    command.mode(),
                    ((Indent) doc).contents(),
                    RecursionTooDeepException.check(command.depth() + 1, maxDepth)));
            case TRIM -> trim();
            case GROUP -> processGroup(command, (Group) doc);
            case FILL -> processFill(command, (Fill) doc);
            case IF_BREAK -> processIfBreak(command, (IfBreak) doc);
            case LINE_SUFFIX -> lineSuffixes.add(command.child(((LineSuffix) doc).contents(), maxDepth));
            case LINE -> processLine(command, (Line) doc);
            case BREAK_PARENT -> {
                // already accounted for by BreakPropagator
            }
        }
    }

    private void processGroup(Command command, Group group) {
        boolean mustBreak = group.shouldBreak() || brokenGroups.contains(group);
        PrintMode groupMode;

        if (command.mode() == PrintMode.FLAT && !shouldRemeasure) {
            groupMode = mustBreak ? PrintMode.BREAK : PrintMode.FLAT;
            commands.push(command.child(groupMode, group.contents(), maxDepth));
        } else {
            shouldRemeasure = false;
            Command flat = command.child(PrintMode.FLAT, group.contents(), maxDepth);
            if (!mustBreak && Fits.fits(flat, commands, remainingWidth(), config.getTabWidth(), groupModes, brokenGroups, false)) {
                groupMode = PrintMode.FLAT;
                commands.push(flat);
            } else {
                groupMode = PrintMode.BREAK;
                commands.push(command.child(PrintMode.BREAK, group.contents(), maxDepth));
            }
        }

        if (group.id() != null) {
            groupModes.put(group.id(), groupMode);
        }
    }

    /**
     * Prints the next content of a fill and decides the separator after it: flat
     * if the following content also fits on this line, broken otherwise. The rest
     * of the fill goes back on the stack as the same fill at a later offset.
     */
    private void processFill(Command command, Fill fill) {
        List<Doc> parts = fill.parts();
        int offset = command.fillOffset();
        int remainingParts = parts.size() - offset;
        if (remainingParts <= 0) {
            return;
        }

        int width = remainingWidth();
        Doc content = parts.get(offset);
        Command contentFlat = command.child(PrintMode.FLAT, content, maxDepth);
        Command contentBreak = command.child(PrintMode.BREAK, content, maxDepth);
        boolean contentFits = Fits.fits(contentFlat, NO_COMMANDS, width, config.getTabWidth(), groupModes, brokenGroups, true);

        if (remainingParts == 1) {
            commands.push(contentFits ? contentFlat : contentBreak);
            return;
        }

        Doc separator = parts.get(offset + 1);
        Command separatorFlat = command.child(PrintMode.FLAT, separator, maxDepth);
        Command separatorBreak = command.child(PrintMode.BREAK, separator, maxDepth);

        if (remainingParts == 2) {
            if (contentFits) {
                commands.push(separatorFlat);
                commands.push(contentFlat);
            } else {
                commands.push(separatorBreak);
                commands.push(contentBreak);
            }
            return;
        }

        Doc nextContent = parts.get(offset + 2);
        Command pairFlat = command.child(PrintMode.FLAT, new Concat(List.of(content, separator, nextContent)), maxDepth);
        boolean pairFits = Fits.fits(pairFlat, NO_COMMANDS, width, config.getTabWidth(), groupModes, brokenGroups, true);

        commands.push(new Command(command.indentation(), command.mode(), fill, command.depth(), offset + 2));
        if (pairFits) {
            commands.push(separatorFlat);
            commands.push(contentFlat);
        } else if (contentFits) {
            commands.push(separatorBreak);
            commands.push(contentFlat);
        } else {
            commands.push(separatorBreak);
            commands.push(contentBreak);
        }
    }

    private void processIfBreak(Command command, IfBreak ifBreak) {
        PrintMode groupMode = command.mode();
        if (ifBreak.groupId() != null) {
            groupMode = groupModes.get(ifBreak.groupId());
            if (groupMode == null) {
                throw new IllegalStateException("IfBreak refers to group '" + ifBreak.groupId().getName()
                        + "' before that group is printed");
            }
        }
        Doc contents = groupMode == PrintMode.BREAK ? ifBreak.breakContents() : ifBreak.flatContents();
        commands.push(command.child(contents, maxDepth));
    }

    private void processLine(Command command, Line line) {
        if (command.mode() == PrintMode.FLAT) {
            if (line.lineKind() == LineKind.SOFT) {
                output.append(' ');
                position++;
                return;
            }
            if (line.lineKind() == LineKind.SOFT_EMPTY) {
                return;
            }
            // a forced newline inside a flat run, groups after it are measured again
            shouldRemeasure = true;
        }

        if (!lineSuffixes.isEmpty()) {
            commands.push(command);
            pushLineSuffixes();
            return;
        }

        trim();
        output.append(config.lineEnding());
        if (line.lineKind() == LineKind.LITERAL) {
            position = 0;
        } else {
            output.append(command.indentation().value());
            position = command.indentation().width();
        }
    }

    /**
     * Schedules the pending line suffixes so they print next, in the order they were met.
     */
    private void pushLineSuffixes() {
        for (int i = lineSuffixes.size() - 1; i >= 0; i--) {
            commands.push(lineSuffixes.get(i));
        }
        lineSuffixes.clear();
    }

    private void trim() {
        int end = output.length();
        while (end > 0) {
            char c = output.charAt(end - 1);
            if (c != ' ' && c != '\t') {
                break;
            }
            end--;
        }
        if (end == output.length()) {
            return;
        }
        output.setLength(end);
        position = currentLineWidth();
    }

    private int currentLineWidth() {
        int lineStart = output.lastIndexOf("\n") + 1;
        int base = lineStart == 0 ? startColumn : 0;
        return base + StringWidth.of(output.subSequence(lineStart, output.length()), config.getTabWidth());
    }

    private int remainingWidth() {
        return config.getMaxWidth() - position;
    }
}
