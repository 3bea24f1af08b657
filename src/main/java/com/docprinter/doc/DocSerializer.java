package com.docprinter.doc;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts documents to and from a tree of tagged JSON objects, for snapshot
 * tests and debugging tools. Each object names its variant under {@code kind}
 * and carries its flags and children; sequences keep their order.
 *
 * <pre>
 * {"kind":"group","break":false,"id":"args","contents":{"kind":"concat","parts":[...]}}
 * </pre>
 *
 * Group ids are written by name. Distinct ids sharing a name get a {@code #n} suffix
 * so that reading the tree back links each {@code ifBreak} to the right group.
 *
 * <p>All walks use explicit stacks, and the JSON nesting limits are derived from
 * {@code maxDepth}, so any document the printer accepts can be written and read back.
 */
public final class DocSerializer {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final int maxDepth;
    private final Map<GroupId, String> idNames = new IdentityHashMap<>();
    private final Map<String, Integer> nameCounts = new HashMap<>();
    private final Map<String, GroupId> idsByName = new HashMap<>();

    private DocSerializer(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public static JsonNode toTree(Doc doc, int maxDepth) {
        return new DocSerializer(maxDepth).write(doc);
    }

    public static String toJson(Doc doc, int maxDepth) {
        JsonNode tree = toTree(doc, maxDepth);
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = jsonFactory(maxDepth).createGenerator(out)) {
            generator.useDefaultPrettyPrinter();
            writeJson(tree, generator);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize document", e);
        }
        return out.toString();
    }

    public static Doc fromTree(JsonNode node, int maxDepth) {
        return new DocSerializer(maxDepth).read(node);
    }

    public static Doc fromJson(String json, int maxDepth) throws JsonProcessingException {
        return fromTree(new ObjectMapper(jsonFactory(maxDepth)).readTree(json), maxDepth);
    }

    /**
     * Every document level adds at most two JSON levels: the object and its {@code parts} array.
     */
    private static int jsonNestingLimit(int maxDepth) {
        return 2 * maxDepth + 2;
    }

    private static JsonFactory jsonFactory(int maxDepth) {
        int nesting = jsonNestingLimit(maxDepth);
        return JsonFactory.builder()
                .streamReadConstraints(StreamReadConstraints.builder().maxNestingDepth(nesting).build())
                .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(nesting).build())
                .build();
    }

    // writing

    /**
     * A document waiting to be written, and where its node goes: into {@code array}
     * if set, else under {@code field} of {@code parent}, else it is the root.
     */
    private record WriteTask(Doc doc, int depth, ObjectNode parent, String field, ArrayNode array) {
    }

    private JsonNode write(Doc root) {
        Deque<WriteTask> tasks = new ArrayDeque<>();
        tasks.push(new WriteTask(root, 0, null, null, null));
        JsonNode result = null;

        while (!tasks.isEmpty()) {
            WriteTask task = tasks.pop();
            Doc doc = task.doc();
            ObjectNode node = NODES.objectNode();
            node.put("kind", doc.kind().getTag());
            if (task.array() != null) {
                task.array().add(node);
            } else if (task.parent() != null) {
                task.parent().set(task.field(), node);
            } else {
                result = node;
            }

            int childDepth = task.depth() + 1;
            switch (doc.kind()) {
                case TEXT -> node.put("value", ((Text) doc).value());
                case CONCAT -> pushParts(tasks, node, ((Concat) doc).parts(), childDepth);
                case FILL -> pushParts(tasks, node, ((Fill) doc).parts(), childDepth);
                case LINE -> node.put("lineKind", ((Line) doc).lineKind().name().toLowerCase(Locale.ROOT));
                case GROUP -> {
                    Group group = (Group) doc;
                    node.put("break", group.shouldBreak());
                    if (group.id() != null) {
                        node.put("id", nameOf(group.id()));
                    }
                    pushField(tasks, node, "contents", group.contents(), childDepth);
                }
                case INDENT -> pushField(tasks, node, "contents", ((Indent) doc).contents(), childDepth);
                case LINE_SUFFIX -> pushField(tasks, node, "contents", ((LineSuffix) doc).contents(), childDepth);
                case IF_BREAK -> {
                    IfBreak ifBreak = (IfBreak) doc;
                    if (ifBreak.groupId() != null) {
                        node.put("groupId", nameOf(ifBreak.groupId()));
                    }
                    pushField(tasks, node, "flatContents", ifBreak.flatContents(), childDepth);
                    pushField(tasks, node, "breakContents", ifBreak.breakContents(), childDepth);
                }
                case BREAK_PARENT, TRIM -> {
                }
            }
        }
        return result;
    }

    private void pushField(Deque<WriteTask> tasks, ObjectNode parent, String field, Doc doc, int depth) {
        tasks.push(new WriteTask(doc, RecursionTooDeepException.check(depth, maxDepth), parent, field, null));
    }

    private void pushParts(Deque<WriteTask> tasks, ObjectNode parent, List<Doc> parts, int depth) {
        ArrayNode array = parent.putArray("parts");
        for (int i = parts.size() - 1; i >= 0; i--) {
            tasks.push(new WriteTask(parts.get(i), RecursionTooDeepException.check(depth, maxDepth), null, null, array));
        }
    }

    private String nameOf(GroupId id) {
        return idNames.computeIfAbsent(id, key -> {
            int count = nameCounts.merge(key.getName(), 1, Integer::sum);
            return count == 1 ? key.getName() : key.getName() + "#" + count;
        });
    }

    /**
     * Streams a tree of objects, arrays and scalars without recursing.
     */
    private static void writeJson(JsonNode root, JsonGenerator generator) throws IOException {
        Deque<Iterator<?>> open = new ArrayDeque<>();
        open(root, generator, open);

        while (!open.isEmpty()) {
            Iterator<?> children = open.peek();
            if (!children.hasNext()) {
                open.pop();
                if (generator.getOutputContext().inArray()) {
                    generator.writeEndArray();
                } else {
                    generator.writeEndObject();
                }
                continue;
            }
            Object next = children.next();
            if (next instanceof Map.Entry) {
                @SuppressWarnings("unchecked")
                Map.Entry<String, JsonNode> field = (Map.Entry<String, JsonNode>) next;
                generator.writeFieldName(field.getKey());
                open(field.getValue(), generator, open);
            } else {
                open((JsonNode) next, generator, open);
            }
        }
    }

    private static void open(JsonNode node, JsonGenerator generator, Deque<Iterator<?>> open) throws IOException {
        if (node.isObject()) {
            generator.writeStartObject();
            open.push(node.fields());
        } else if (node.isArray()) {
            generator.writeStartArray();
            open.push(node.elements());
        } else if (node.isBoolean()) {
            generator.writeBoolean(node.booleanValue());
        } else if (node.isNumber()) {
            generator.writeNumber(node.asText());
        } else if (node.isNull()) {
            generator.writeNull();
        } else {
            generator.writeString(node.asText());
        }
    }

    // reading

    /**
     * A JSON node to read. On exit, its children are the last entries of the results stack.
     */
    private record ReadTask(JsonNode node, DocKind kind, int depth, boolean exit) {
    }

    private Doc read(JsonNode root) {
        Deque<ReadTask> tasks = new ArrayDeque<>();
        List<Doc> results = new ArrayList<>();
        tasks.push(new ReadTask(root, null, 0, false));

        while (!tasks.isEmpty()) {
            ReadTask task = tasks.pop();
            JsonNode node = task.node();

            if (task.exit()) {
                results.add(build(task.kind(), node, results));
                continue;
            }

            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("Expected a document object but found: "
                        + (node == null ? "nothing" : node.getNodeType()));
            }
            DocKind kind = DocKind.fromTag(requireText(node, "kind"));
            int childDepth = task.depth() + 1;

            switch (kind) {
                case TEXT -> results.add(new Text(requireText(node, "value")));
                case LINE -> results.add(new Line(LineKind.valueOf(requireText(node, "lineKind").toUpperCase(Locale.ROOT))));
                case BREAK_PARENT -> results.add(BreakParent.INSTANCE);
                case TRIM -> results.add(Trim.INSTANCE);
                case CONCAT, FILL -> {
                    JsonNode parts = requireParts(node);
                    tasks.push(new ReadTask(node, kind, task.depth(), true));
                    for (int i = parts.size() - 1; i >= 0; i--) {
                        pushChild(tasks, parts.get(i), childDepth);
                    }
                }
                case GROUP, INDENT, LINE_SUFFIX -> {
                    tasks.push(new ReadTask(node, kind, task.depth(), true));
                    pushChild(tasks, requireChild(node, "contents"), childDepth);
                }
                case IF_BREAK -> {
                    tasks.push(new ReadTask(node, kind, task.depth(), true));
                    pushChild(tasks, requireChild(node, "flatContents"), childDepth);
                    pushChild(tasks, requireChild(node, "breakContents"), childDepth);
                }
            }
        }
        return results.get(0);
    }

    private void pushChild(Deque<ReadTask> tasks, JsonNode child, int depth) {
        tasks.push(new ReadTask(child, null, RecursionTooDeepException.check(depth, maxDepth), false));
    }

    /**
     * Builds a container from the children just read, removing them from {@code results}.
     */
    private Doc build(DocKind kind, JsonNode node, List<Doc> results) {
        int childCount = switch (kind) {
            case CONCAT, FILL -> node.get("parts").size();
            case IF_BREAK -> 2;
            default -> 1;
        };
        List<Doc> tail = results.subList(results.size() - childCount, results.size());
        List<Doc> children = new ArrayList<>(tail);
        tail.clear();

        return switch (kind) {
            case CONCAT -> new Concat(children);
            case FILL -> new Fill(children);
            case GROUP -> new Group(
                    children.get(0),
                    node.path("break").asBoolean(false),
                    node.hasNonNull("id") ? idNamed(node.get("id").asText()) : null);
            case INDENT -> new Indent(children.get(0));
            case LINE_SUFFIX -> new LineSuffix(children.get(0));
            case IF_BREAK -> new IfBreak(
                    children.get(0),
                    children.get(1),
                    node.hasNonNull("groupId") ? idNamed(node.get("groupId").asText()) : null);
            default -> throw new IllegalStateException("Not a container: " + kind);
        };
    }

    private GroupId idNamed(String name) {
        return idsByName.computeIfAbsent(name, GroupId::create);
    }

    private static JsonNode requireParts(JsonNode node) {
        JsonNode parts = node.get("parts");
        if (parts == null || !parts.isArray()) {
            throw new IllegalArgumentException("Expected a 'parts' array in a " + node.path("kind").asText() + " object");
        }
        return parts;
    }

    private static JsonNode requireChild(JsonNode node, String field) {
        JsonNode child = node.get(field);
        if (child == null) {
            throw new IllegalArgumentException("Missing '" + field + "' in a " + node.path("kind").asText() + " object");
        }
        return child;
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException("Missing '" + field + "' in a "
                    + node.path("kind").asText("document") + " object");
        }
        return value.asText();
    }
}
