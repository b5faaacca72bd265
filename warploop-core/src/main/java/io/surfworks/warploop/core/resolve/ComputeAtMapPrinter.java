package io.surfworks.warploop.core.resolve;

import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import io.surfworks.warploop.core.LoopMapConfig.DumpFormat;
import io.surfworks.warploop.core.graph.DomainGraph;
import io.surfworks.warploop.core.graph.IdGroup;
import io.surfworks.warploop.core.graph.IdMappingMode;
import io.surfworks.warploop.ir.IterDomain;

/**
 * Diagnostic dump of a resolved compute-at map.
 *
 * <p>The text form lists the classes of each relation with the concrete member
 * marked {@code *}, then the consumer, producer and sibling maps. The JSON form
 * carries the same content. Neither has a parsing contract.
 */
public final class ComputeAtMapPrinter {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private ComputeAtMapPrinter() {}

    public static String print(ConcreteResolver resolver, DumpFormat format) {
        return format == DumpFormat.JSON ? toJson(resolver) : toText(resolver);
    }

    public static String toText(ConcreteResolver resolver) {
        DomainGraph graph = resolver.idGraph();
        StringBuilder sb = new StringBuilder();
        sb.append("Compute at map {\n");
        sb.append("Permissive map:\n");
        appendClasses(sb, resolver, IdMappingMode.PERMISSIVE);
        sb.append("Exact map:\n");
        appendClasses(sb, resolver, IdMappingMode.EXACT);
        sb.append("Loop map:\n");
        appendClasses(sb, resolver, IdMappingMode.LOOP);

        sb.append("Consumer maps:\n");
        for (IterDomain id : graph.allIds()) {
            sb.append("  ").append(id).append(" :: ").append(setToString(graph.consumersOf(id))).append('\n');
        }
        sb.append("Producer maps:\n");
        for (IterDomain id : graph.allIds()) {
            sb.append("  ").append(id).append(" :: ").append(setToString(graph.producersOf(id))).append('\n');
        }
        sb.append("Sibling map:\n");
        for (List<IterDomain> siblings : graph.siblingGroups()) {
            sb.append("  ").append(setToString(siblings)).append('\n');
        }
        sb.append("} compute at map\n");
        return sb.toString();
    }

    private static void appendClasses(StringBuilder sb, ConcreteResolver resolver, IdMappingMode mode) {
        for (IdGroup group : resolver.idGraph().disjointSets(mode)) {
            IterDomain concrete = resolver.getConcreteMappedID(group.front(), mode);
            sb.append("  {");
            List<IterDomain> members = group.members();
            for (int i = 0; i < members.size(); i++) {
                IterDomain member = members.get(i);
                sb.append(member);
                if (member == concrete) {
                    sb.append('*');
                }
                if (i < members.size() - 1) {
                    sb.append("; ");
                }
            }
            sb.append(" }\n");
        }
    }

    private static String setToString(List<IterDomain> ids) {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < ids.size(); i++) {
            if (i > 0) {
                sb.append("; ");
            }
            sb.append(ids.get(i));
        }
        return sb.append('}').toString();
    }

    // ==================== JSON ====================

    public static String toJson(ConcreteResolver resolver) {
        DomainGraph graph = resolver.idGraph();
        JsonObject root = new JsonObject();
        root.add("permissive", classesToJson(resolver, IdMappingMode.PERMISSIVE));
        root.add("exact", classesToJson(resolver, IdMappingMode.EXACT));
        root.add("loop", classesToJson(resolver, IdMappingMode.LOOP));

        JsonObject consumers = new JsonObject();
        JsonObject producers = new JsonObject();
        for (IterDomain id : graph.allIds()) {
            consumers.add(id.toString(), idsToJson(graph.consumersOf(id)));
            producers.add(id.toString(), idsToJson(graph.producersOf(id)));
        }
        root.add("consumers", consumers);
        root.add("producers", producers);

        JsonArray siblings = new JsonArray();
        for (List<IterDomain> group : graph.siblingGroups()) {
            siblings.add(idsToJson(group));
        }
        root.add("siblings", siblings);

        JsonArray viewRfactor = idsToJson(graph.viewRfactorIds());
        root.add("viewRfactor", viewRfactor);
        return GSON.toJson(root);
    }

    private static JsonArray classesToJson(ConcreteResolver resolver, IdMappingMode mode) {
        JsonArray classes = new JsonArray();
        for (IdGroup group : resolver.idGraph().disjointSets(mode)) {
            JsonObject entry = new JsonObject();
            entry.addProperty("concrete", resolver.getConcreteMappedID(group.front(), mode).toString());
            entry.add("members", idsToJson(group.members()));
            classes.add(entry);
        }
        return classes;
    }

    private static JsonArray idsToJson(List<IterDomain> ids) {
        JsonArray array = new JsonArray();
        for (IterDomain id : ids) {
            array.add(id.toString());
        }
        return array;
    }
}
