package com.dpw.fixrunner.resolver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.dpw.fixrunner.exception.PlaceholderResolutionException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PlaceholderResolverTest {

    private final PlaceholderResolver resolver = new PlaceholderResolver();
    private ResolvedRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ResolvedRegistry();
        registry.register("TC1", Map.of("11", "TC1_abcd1234", "35", "D"));
        registry.register("UC.TC.2", Map.of("11", "dotted"));
    }

    @Test
    void textWithoutPlaceholdersIsReturnedAsIs() {
        assertThat(resolver.resolve("plain", Map.of(), registry)).isEqualTo("plain");
        assertThat(resolver.resolve(null, Map.of(), registry)).isNull();
    }

    @Test
    void resolvesLocalTag() {
        assertThat(resolver.resolve("${38}", Map.of("38", "100"), registry)).isEqualTo("100");
    }

    @Test
    void resolvesCrossCaseReference() {
        assertThat(resolver.resolve("${TC1.11}", Map.of(), registry)).isEqualTo("TC1_abcd1234");
    }

    @Test
    void splitsReferenceAtLastDot() {
        assertThat(resolver.resolve("${UC.TC.2.11}", Map.of(), registry)).isEqualTo("dotted");
    }

    @Test
    void resolvesSeveralPlaceholdersInOneValue() {
        String resolved = resolver.resolve("${TC1.35}-${38}-x", Map.of("38", "7"), registry);

        assertThat(resolved).isEqualTo("D-7-x");
    }

    @Test
    void replacementValuesAreTakenLiterally() {
        assertThat(resolver.resolve("${58}", Map.of("58", "$1\\n"), registry)).isEqualTo("$1\\n");
    }

    @Test
    void unknownLocalTagFails() {
        assertThatThrownBy(() -> resolver.resolve("${999}", Map.of(), registry))
                .isInstanceOf(PlaceholderResolutionException.class)
                .hasMessageContaining("${999}");
    }

    @Test
    void forwardReferenceFails() {
        assertThatThrownBy(() -> resolver.resolve("${TC9.11}", Map.of(), registry))
                .isInstanceOf(PlaceholderResolutionException.class)
                .hasMessageContaining("has not been executed yet");
    }

    @Test
    void referenceToTagTheCaseDidNotSendFails() {
        assertThatThrownBy(() -> resolver.resolve("${TC1.44}", Map.of(), registry))
                .isInstanceOf(PlaceholderResolutionException.class)
                .hasMessageContaining("tag 44");
    }

    @Test
    void missingRegistryMeansNothingHasRun() {
        assertThatThrownBy(() -> resolver.resolve("${TC1.11}", Map.of(), null))
                .isInstanceOf(PlaceholderResolutionException.class)
                .hasMessageContaining("has not been executed yet");
    }

    @Test
    void resolveAllKeepsOrder() {
        Map<String, String> resolved = resolver.resolveAll(
                new LinkedHashMap<>(Map.of("41", "${TC1.11}")), Map.of(), registry);

        assertThat(resolved).containsExactly(Map.entry("41", "TC1_abcd1234"));
    }
}
