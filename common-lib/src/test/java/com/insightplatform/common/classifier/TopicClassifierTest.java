package com.insightplatform.common.classifier;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TopicClassifierTest {

    @Nested
    @DisplayName("global taxonomy")
    class TaxonomyTests {

        @Test
        @DisplayName("longest varietal wins over its prefix")
        void longestMatch() {
            assertEquals("pinot noir", TopicClassifier.classify("best pinot noir under 100", List.of()));
            assertEquals("cabernet sauvignon", TopicClassifier.classify("cabernet sauvignon 2019", List.of()));
        }

        @Test
        @DisplayName("equal-length matches resolve by declaration order")
        void tieBreakByOrder() {
            // merlot precedes malbec in the taxonomy
            assertEquals("merlot", TopicClassifier.classify("malbec or merlot", List.of()));
        }

        @Test
        @DisplayName("raw input is normalized before matching")
        void normalizesInput() {
            assertEquals("rose", TopicClassifier.classify("Rosé Wine", null));
        }

        @Test
        @DisplayName("no match → other")
        void other() {
            assertEquals(TopicClassifier.OTHER, TopicClassifier.classify("orange wine", List.of()));
            assertEquals(TopicClassifier.OTHER, TopicClassifier.classify("", List.of()));
            assertEquals(TopicClassifier.OTHER, TopicClassifier.classify(null, List.of()));
        }
    }

    @Nested
    @DisplayName("store entities")
    class EntityTests {

        @Test
        @DisplayName("known entity beats the taxonomy; longest entity wins")
        void entityFirst() {
            assertEquals("golan heights",
                TopicClassifier.classify("golan heights cabernet", List.of("Golan", "Golan Heights")));
        }

        @Test
        @DisplayName("entities shorter than 3 characters are ignored")
        void shortEntitiesIgnored() {
            assertEquals("merlot", TopicClassifier.classify("ab merlot", List.of("AB")));
        }

        @Test
        @DisplayName("null entity names are tolerated")
        void nullEntities() {
            assertEquals("syrah", TopicClassifier.classify("syrah", java.util.Arrays.asList(null, "Tabor")));
        }
    }
}
