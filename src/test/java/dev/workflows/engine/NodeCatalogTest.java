package dev.workflows.engine;

import dev.workflows.model.*;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NodeCatalogTest {

    @Test
    void ranksByAccumulatedScore() {
        var ranked = NodeCatalog.rank("Store it in the postgres database");

        assertThat(ranked).isNotEmpty();
        assertThat(ranked.get(0).type()).isEqualTo(NodeType.POSTGRES);
        assertThat(ranked.get(1).type()).isEqualTo(NodeType.MYSQL);
        assertThat(ranked.get(0).score()).isGreaterThan(ranked.get(1).score());
    }

    @Test
    void equalScoresKeepCatalogOrder() {
        var best = NodeCatalog.bestMatch("run the sql");

        assertThat(best).map(NodeCatalog.CatalogMatch::type).contains(NodeType.POSTGRES);
    }

    @Test
    void matchesWholeWordsOnly() {
        assertThat(NodeCatalog.bestMatch("cached values")).isEmpty();
        assertThat(NodeCatalog.bestMatch("cache values")).map(NodeCatalog.CatalogMatch::type)
            .contains(NodeType.REDIS);
    }

    @Test
    void blankTextHasNoMatch() {
        assertThat(NodeCatalog.rank("   ")).isEmpty();
        assertThat(NodeCatalog.bestMatch(null)).isEmpty();
    }

    @Test
    void everyEntryNamesACatalogType() {
        assertThat(NodeCatalog.ENTRIES).allSatisfy(entry -> {
            assertThat(entry.type()).isNotEqualTo(NodeType.UNRECOGNIZED);
            assertThat(entry.commonNames()).isNotEmpty();
        });
    }
}
