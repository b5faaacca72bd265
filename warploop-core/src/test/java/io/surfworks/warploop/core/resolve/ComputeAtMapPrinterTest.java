package io.surfworks.warploop.core.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.warploop.core.LoopMapConfig;
import io.surfworks.warploop.core.graph.IdMappingMode;
import io.surfworks.warploop.ir.Fusion;
import io.surfworks.warploop.ir.TensorOps;
import io.surfworks.warploop.ir.TensorView;

@DisplayName("ComputeAtMapPrinter")
class ComputeAtMapPrinterTest {

    private final Fusion fusion = new Fusion();
    private final TensorView tv0 = fusion.makeSymbolicTensor(2);
    private final TensorView tv1 = TensorOps.unary("neg", tv0);
    private final TensorView tv2 = TensorOps.unary("exp", tv1);

    ComputeAtMapPrinterTest() {
        tv2.merge(0).split(0, 128);
        tv1.merge(0).split(0, 128);
        tv1.setComputeAt(1);
    }

    @Nested
    @DisplayName("Text")
    class TextTests {

        @Test
        @DisplayName("lists every section")
        void sections() {
            String text = ConcreteResolver.build(fusion).toString();

            assertTrue(text.startsWith("Compute at map {"));
            for (String section : List.of("Permissive map:", "Exact map:", "Loop map:",
                    "Consumer maps:", "Producer maps:", "Sibling map:")) {
                assertTrue(text.contains(section), section);
            }
            assertTrue(text.endsWith("} compute at map\n"));
        }

        @Test
        @DisplayName("marks concrete ids")
        void marksConcrete() {
            String text = ComputeAtMapPrinter.toText(ConcreteResolver.build(fusion));

            assertTrue(text.contains("{" + tv2.axis(0) + "*; " + tv1.axis(0) + " }"), text);
        }

        @Test
        @DisplayName("lists consumers of each domain")
        void consumers() {
            String text = ComputeAtMapPrinter.toText(ConcreteResolver.build(fusion));

            assertTrue(text.contains("  " + tv0.axis(0) + " :: {" + tv1.rootDomain().get(0) + "}"), text);
        }
    }

    @Nested
    @DisplayName("JSON")
    class JsonTests {

        @Test
        @DisplayName("carries one entry per class with its concrete id")
        void classes() {
            ConcreteResolver resolver = ConcreteResolver.build(fusion);

            JsonObject json = JsonParser.parseString(ComputeAtMapPrinter.toJson(resolver)).getAsJsonObject();

            JsonArray loop = json.getAsJsonArray("loop");
            assertEquals(resolver.idGraph().disjointSets(IdMappingMode.LOOP).size(), loop.size());
            boolean found = false;
            for (JsonElement element : loop) {
                JsonObject entry = element.getAsJsonObject();
                if (entry.getAsJsonArray("members").size() == 2) {
                    assertEquals(tv2.axis(0).toString(), entry.get("concrete").getAsString());
                    found = true;
                }
            }
            assertTrue(found);
            assertEquals(3, json.getAsJsonArray("exact").get(0).getAsJsonObject().getAsJsonArray("members").size());
        }

        @Test
        @DisplayName("carries adjacency and sibling maps")
        void adjacency() {
            JsonObject json = JsonParser.parseString(
                    ComputeAtMapPrinter.toJson(ConcreteResolver.build(fusion))).getAsJsonObject();

            JsonArray consumers = json.getAsJsonObject("consumers").getAsJsonArray(tv0.axis(0).toString());
            assertEquals(1, consumers.size());
            assertEquals(tv1.rootDomain().get(0).toString(), consumers.get(0).getAsString());
            assertEquals(0, json.getAsJsonArray("siblings").size());
            assertEquals(0, json.getAsJsonArray("viewRfactor").size());
        }
    }

    @Nested
    @DisplayName("Configured dump")
    class DumpTests {

        private final Logger logger = Logger.getLogger(ConcreteResolver.class.getName());
        private final List<LogRecord> records = new ArrayList<>();
        private final Handler capture = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {}

            @Override
            public void close() {}
        };

        @AfterEach
        void tearDown() {
            logger.removeHandler(capture);
            LoopMapConfig.disableDump();
        }

        @Test
        @DisplayName("logs the JSON dump at INFO when enabled")
        void logsJson() {
            logger.addHandler(capture);
            LoopMapConfig.enableDump(LoopMapConfig.DumpFormat.JSON);

            ConcreteResolver.build(fusion);

            assertTrue(records.stream().anyMatch(r -> r.getLevel() == Level.INFO
                    && r.getMessage().contains("\"loop\"")));
        }

        @Test
        @DisplayName("stays quiet when disabled")
        void quietWhenDisabled() {
            logger.addHandler(capture);
            LoopMapConfig.disableDump();

            ConcreteResolver.build(fusion);

            assertTrue(records.stream().noneMatch(r -> r.getLevel() == Level.INFO));
        }
    }
}
