package de.uos.ikw.izpb.nlp;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoreNlpDependencyParserTest {

    @Test
    void missingLanguageSettingsAreReported() {
        assertThatThrownBy(() -> new CoreNlpDependencyParser("StanfordCoreNLP-klingon.properties"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("-Pgerman-models");
    }
}
