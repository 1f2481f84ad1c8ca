package com.retailops.knowledge;

import com.retailops.config.GatewayProperties;
import com.retailops.errors.ErrorKind;
import com.retailops.errors.GatewayException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KnowledgeIndexTest {

    private KnowledgeIndex index;

    @BeforeEach
    void setUp() throws Exception {
        index = new KnowledgeIndex(new GatewayProperties());
        index.load();
    }

    @Test
    void fetchReturnsCitationReadySection() {
        KnowledgeSection section = index.fetch("doc:Returns_and_Holds_Policy#section-3");

        assertThat(section.title()).isEqualTo("Returns and Holds Policy: Store Holds");
        assertThat(section.url()).isEqualTo("https://retailnext.internal/docs/returns#section-3");
        assertThat(section.content().toLowerCase()).contains("store holds");
    }

    @Test
    void searchRanksHoldPolicyFirst() {
        List<KnowledgeSection> hits = index.search("hold duration policy", 5);

        assertThat(hits).isNotEmpty().hasSizeLessThanOrEqualTo(5);
        assertThat(hits.get(0).id()).startsWith("doc:").contains("#section-");
        assertThat(hits).extracting(KnowledgeSection::id).contains("doc:Returns_and_Holds_Policy#section-3");
    }

    @Test
    void emptyQueryReturnsSectionsOrderedById() {
        List<KnowledgeSection> hits = index.search("", 3);

        assertThat(hits).hasSize(3);
        assertThat(hits).extracting(KnowledgeSection::id).isSorted();
    }

    @Test
    void unknownIdIsInvalidArguments() {
        assertThatThrownBy(() -> index.fetch("doc:Nope#section-1"))
                .isInstanceOf(GatewayException.class)
                .extracting(e -> ((GatewayException) e).kind())
                .isEqualTo(ErrorKind.INVALID_ARGUMENTS);
    }

    @Test
    void fileWithoutHeadingsIsOneSection() {
        List<KnowledgeSection> sections = index.parse("Store_Notes", "just a paragraph\nand another line\n");

        assertThat(sections).hasSize(1);
        assertThat(sections.get(0).id()).isEqualTo("doc:Store_Notes#section-1");
        assertThat(sections.get(0).title()).isEqualTo("Store Notes");
        assertThat(sections.get(0).url()).isEqualTo("https://retailnext.internal/docs/store-notes#section-1");
    }

    @Test
    void everyHeadingStartsANewSection() {
        List<KnowledgeSection> sections = index.parse("Support_Runbook", "# Top\nintro\n## A\nbody a\n### B\nbody b");

        assertThat(sections).extracting(KnowledgeSection::title)
                .containsExactly("Support Runbook: Top", "Support Runbook: A", "Support Runbook: B");
        assertThat(sections.get(1).content()).isEqualTo("## A\nbody a");
        assertThat(sections.get(2).url()).endsWith("/support-runbook#section-3");
    }
}
