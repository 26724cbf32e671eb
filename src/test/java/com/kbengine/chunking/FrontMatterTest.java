package com.kbengine.chunking;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FrontMatterTest {

    @Test
    @DisplayName("Attributes are read and the body follows the closing delimiter")
    void parsesAttributes() {
        FrontMatter frontMatter = FrontMatter.parse("""
            ---
            title: Order
            tags: [sales, core]
            owners: billing, finance
            ---
            # Order
            """);

        assertThat(frontMatter.string("title")).isEqualTo("Order");
        assertThat(frontMatter.strings("tags")).containsExactly("sales", "core");
        assertThat(frontMatter.strings("owners")).containsExactly("billing", "finance");
        assertThat(frontMatter.strings("missing")).isEmpty();
        assertThat(frontMatter.body()).isEqualTo("# Order\n");
    }

    @Test
    @DisplayName("Content without a leading delimiter has no attributes")
    void noFrontMatter() {
        FrontMatter frontMatter = FrontMatter.parse("# Order\n---\nnot: front matter\n---\n");

        assertThat(frontMatter.attributes()).isEmpty();
        assertThat(frontMatter.body()).startsWith("# Order");
    }

    @Test
    @DisplayName("Malformed YAML is ignored but still stripped from the body")
    void malformedYaml() {
        FrontMatter frontMatter = FrontMatter.parse("---\ntitle: [unclosed\n---\nBody");

        assertThat(frontMatter.attributes()).isEmpty();
        assertThat(frontMatter.body()).isEqualTo("Body");
    }
}
