package com.terminaldesigner.designer.view;

import com.terminaldesigner.designer.info.ObjectInfoTable;
import com.terminaldesigner.pool.*;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Tree view of a pool as the object panel shows it: rooted at the working set, with every
 * referenced object as a child. References that do not resolve become "missing" leaves.
 * Auxiliary function and input objects sit outside the tree and are listed separately.
 */
public class ObjectHierarchy {

    public static final String NO_WORKING_SET_MESSAGE = "No working set, please add a new working set...";

    /** The tree stops expanding at this depth. */
    static final int MAX_DEPTH = 32;

    private static final ObjectType[] AUXILIARY_TYPES = {
            ObjectType.AUXILIARY_FUNCTION_TYPE_1, ObjectType.AUXILIARY_INPUT_TYPE_1,
            ObjectType.AUXILIARY_FUNCTION_TYPE_2, ObjectType.AUXILIARY_INPUT_TYPE_2
    };

    /**
     * One tree node. {@code type} is null for a missing object.
     */
    public record Node(ObjectId id, ObjectType type, String name, List<Node> children) {
        public Node {
            children = List.copyOf(children);
        }

        public boolean missing() {
            return type == null;
        }

        static Node missing(ObjectId id) {
            return new Node(id, null, "Missing object: " + id, List.of());
        }
    }

    private final ObjectPool pool;
    private final ObjectInfoTable names;
    private final Node root;

    private ObjectHierarchy(ObjectPool pool, ObjectInfoTable names, Node root) {
        this.pool = pool;
        this.names = names;
        this.root = root;
    }

    public static ObjectHierarchy build(ObjectPool pool, ObjectInfoTable names) {
        Node root = pool.workingSetObject()
                .map(ws -> buildNode(pool, names, ws, new HashSet<>(), 0))
                .orElse(null);
        return new ObjectHierarchy(pool, names, root);
    }

    /**
     * Each object is expanded at its first occurrence only. Later occurrences, including the
     * ones closing a cycle, are shown without children, so the tree grows linearly with the pool.
     */
    private static Node buildNode(ObjectPool pool, ObjectInfoTable names, VtObject object,
                                  Set<ObjectId> expanded, int depth) {
        List<Node> children = new ArrayList<>();
        if (depth < MAX_DEPTH && expanded.add(object.id())) {
            for (ObjectId childId : object.referencedObjects()) {
                children.add(pool.objectById(childId)
                        .map(child -> buildNode(pool, names, child, expanded, depth + 1))
                        .orElseGet(() -> Node.missing(childId)));
            }
        }
        return new Node(object.id(), object.type(), names.displayName(object), children);
    }

    public Optional<Node> root() {
        return Optional.ofNullable(root);
    }

    public boolean missingWorkingSet() {
        return root == null;
    }

    public List<VtObject> auxiliaryObjects() {
        return pool.objectsByTypes(AUXILIARY_TYPES);
    }

    /** Pool objects whose displayed name contains {@code filter}, ignoring case. An empty filter matches all. */
    public List<VtObject> filterByName(String filter) {
        String needle = filter == null ? "" : filter.toLowerCase(Locale.ROOT);
        return pool.objects().stream()
                .filter(o -> needle.isEmpty() || names.displayName(o).toLowerCase(Locale.ROOT).contains(needle))
                .collect(Collectors.toList());
    }

    /**
     * Ids of the nodes to expand so that {@code selected} becomes visible: every ancestor on the
     * first path from the root that reaches it, root first. Empty if the selection is not in the tree.
     */
    public List<ObjectId> expandPathTo(ObjectId selected) {
        if (root == null) return List.of();
        Deque<ObjectId> path = new ArrayDeque<>();
        return findPath(root, selected, path) ? new ArrayList<>(path) : List.of();
    }

    private boolean findPath(Node node, ObjectId target, Deque<ObjectId> path) {
        if (node.missing()) return false;
        if (node.id().equals(target)) return true;
        path.addLast(node.id());
        for (Node child : node.children()) {
            if (findPath(child, target, path)) return true;
        }
        path.removeLast();
        return false;
    }

    /** Indented text rendering used by the command line. */
    public String render() {
        StringBuilder out = new StringBuilder();
        if (root == null) {
            out.append(NO_WORKING_SET_MESSAGE).append('\n');
        } else {
            renderNode(root, 0, out);
        }
        List<VtObject> aux = auxiliaryObjects();
        if (!aux.isEmpty()) {
            out.append("--- auxiliary ---\n");
            for (VtObject o : aux) {
                out.append(names.displayName(o)).append('\n');
            }
        }
        return out.toString();
    }

    private void renderNode(Node node, int indent, StringBuilder out) {
        out.append("  ".repeat(indent)).append(node.name());
        if (!node.missing()) {
            out.append(" [").append(node.type().label()).append(']');
        }
        out.append('\n');
        for (Node child : node.children()) {
            renderNode(child, indent + 1, out);
        }
    }
}
