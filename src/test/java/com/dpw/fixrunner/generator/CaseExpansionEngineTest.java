package com.dpw.fixrunner.generator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.dpw.fixrunner.config.FixRunnerProperties;
import com.dpw.fixrunner.exception.ExpansionException;
import com.dpw.fixrunner.model.CaseTemplate;
import com.dpw.fixrunner.model.ConcreteCase;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CaseExpansionEngineTest {

    private CaseExpansionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new CaseExpansionEngine(new FixRunnerProperties(), new CorrelationIdGenerator());
    }

    @Test
    void singleValuedRowExpandsToOneCaseKeepingTheTemplateId() {
        List<ConcreteCase> cases = engine.expand(template("TC1", "35=D|44=10", "39=0"));

        assertThat(cases).hasSize(1);
        ConcreteCase only = cases.get(0);
        assertThat(only.getTestCaseId()).isEqualTo("TC1");
        assertThat(only.getSourceTestCaseId()).isEqualTo("TC1");
        assertThat(only.getUpdateMap()).containsEntry("35", "D").containsEntry("44", "10");
        assertThat(only.getUpdateMap().get("11")).matches("TC1_[0-9a-f]{8}");
        assertThat(only.getCorrelationId()).isEqualTo(only.getUpdateMap().get("11"));
        assertThat(only.getValidateMap()).containsExactly(Map.entry("39", "0"));
        assertThat(only.isChained()).isFalse();
    }

    @Test
    void axisProducesOneCasePerValueWithPositionalValidation() {
        List<ConcreteCase> cases = engine.expand(template("TC2", "35=D|54=1~2~5", "54=1~2~5|39=0"));

        assertThat(cases).extracting(ConcreteCase::getTestCaseId).containsExactly("TC2-1", "TC2-2", "TC2-3");
        assertThat(cases).extracting(c -> c.getUpdateMap().get("54")).containsExactly("1", "2", "5");
        assertThat(cases).extracting(c -> c.getValidateMap().get("54")).containsExactly("1", "2", "5");
        assertThat(cases).extracting(c -> c.getValidateMap().get("39")).containsOnly("0");
        assertThat(cases).extracting(ConcreteCase::getCorrelationId).doesNotHaveDuplicates();
    }

    @Test
    void shortValidationListIsClampedToItsLastValue() {
        List<ConcreteCase> cases = engine.expand(template("TC3", "35=D|54=1~2~5", "150=A~B"));

        assertThat(cases).extracting(c -> c.getValidateMap().get("150")).containsExactly("A", "B", "B");
    }

    @Test
    void multiValuedTypeTagChainsASecondaryToEachPrimary() {
        List<ConcreteCase> cases = engine.expand(template("TC4", "35=D~F|55=IBM", "39=0"));

        assertThat(cases).hasSize(2);
        ConcreteCase primary = cases.get(0);
        ConcreteCase secondary = cases.get(1);

        assertThat(primary.getUpdateMap()).containsEntry("35", "D").doesNotContainKey("41");
        assertThat(secondary.getTestCaseId()).isEqualTo("TC4-F");
        assertThat(secondary.isChained()).isTrue();
        assertThat(secondary.getUpdateMap())
                .containsEntry("35", "F")
                .containsEntry("55", "IBM")
                .containsEntry("41", primary.getCorrelationId());
        assertThat(secondary.getParentCorrelationId()).isEqualTo(primary.getCorrelationId());
        assertThat(secondary.getCorrelationId()).isNotEqualTo(primary.getCorrelationId());
        assertThat(secondary.getValidateMap()).isEqualTo(primary.getValidateMap());
    }

    @Test
    void axisAndTypeChainingCombine() {
        List<ConcreteCase> cases = engine.expand(template("TC5", "35=D~F|54=1~2", ""));

        assertThat(cases).extracting(ConcreteCase::getTestCaseId)
                .containsExactly("TC5-1", "TC5-1-F", "TC5-2", "TC5-2-F");
        assertThat(cases.get(1).getUpdateMap()).containsEntry("41", cases.get(0).getCorrelationId());
        assertThat(cases.get(3).getUpdateMap()).containsEntry("41", cases.get(2).getCorrelationId());
    }

    @Test
    void groupShorthandSetsEveryListedTag() {
        List<ConcreteCase> cases = engine.expand(template("TC6", "35=D|[448~449]=X", "[448~449]=X"));

        assertThat(cases.get(0).getUpdateMap()).containsEntry("448", "X").containsEntry("449", "X");
        assertThat(cases.get(0).getValidateMap()).containsEntry("448", "X").containsEntry("449", "X");
    }

    @Test
    void twoDifferentAxesAreRejected() {
        assertThatThrownBy(() -> engine.expand(template("TC7", "35=D|54=1~2|40=1~2", "")))
                .isInstanceOf(ExpansionException.class)
                .hasMessageContaining("TC7")
                .hasMessageContaining("54")
                .hasMessageContaining("40");
    }

    @Test
    void pinnedIdentifierIsKept() {
        List<ConcreteCase> cases = engine.expand(template("TC8", "35=D|11=FIXED-1", ""));

        assertThat(cases.get(0).getCorrelationId()).isEqualTo("FIXED-1");
        assertThat(cases.get(0).getUpdateMap()).containsEntry("11", "FIXED-1");
    }

    @Test
    void identifierAxisUsesTheListedIdentifiers() {
        List<ConcreteCase> cases = engine.expand(template("TC13", "11=A~B|35=D", "11=A~B"));

        assertThat(cases).extracting(ConcreteCase::getTestCaseId).containsExactly("TC13-1", "TC13-2");
        assertThat(cases).extracting(c -> c.getUpdateMap().get("11")).containsExactly("A", "B");
        assertThat(cases).extracting(ConcreteCase::getCorrelationId).containsExactly("A", "B");
        assertThat(cases).extracting(c -> c.getValidateMap().get("11")).containsExactly("A", "B");
    }

    @Test
    void identifierAxisChainsSecondariesToTheListedIdentifiers() {
        List<ConcreteCase> cases = engine.expand(template("TC14", "11=A~B|35=D~F", ""));

        assertThat(cases).extracting(ConcreteCase::getTestCaseId).containsExactly("TC14-1", "TC14-1-F", "TC14-2", "TC14-2-F");
        assertThat(cases.get(1).getUpdateMap()).containsEntry("41", "A");
        assertThat(cases.get(1).getCorrelationId()).matches("TC14_[0-9a-f]{8}");
        assertThat(cases.get(3).getUpdateMap()).containsEntry("41", "B");
    }

    @Test
    void secondaryParentReferenceAlwaysPointsAtItsPrimary() {
        List<ConcreteCase> cases = engine.expand(template("TC15", "35=D~F|41=OTHER", ""));

        assertThat(cases.get(0).getUpdateMap()).containsEntry("41", "OTHER");
        assertThat(cases.get(1).getUpdateMap()).containsEntry("41", cases.get(0).getCorrelationId());
    }

    @Test
    void emptyUpdateValueIsKeptAsDeletion() {
        List<ConcreteCase> cases = engine.expand(template("TC9", "35=D|58=", "58="));

        assertThat(cases.get(0).getUpdateMap()).containsEntry("58", "");
        assertThat(cases.get(0).getValidateMap()).containsEntry("58", "");
    }

    @Test
    void malformedTokensAreDropped() {
        List<ConcreteCase> cases = engine.expand(template("TC10", "35=D|junk|44=1", "nonsense|39=0"));

        assertThat(cases.get(0).getUpdateMap()).containsKeys("35", "44", "11").hasSize(3);
        assertThat(cases.get(0).getValidateMap()).containsExactly(Map.entry("39", "0"));
    }

    @Test
    void placeholdersAreLeftForTheRunner() {
        List<ConcreteCase> cases = engine.expand(template("TC11", "35=F|41=${TC1.11}", "37=${37}"));

        assertThat(cases.get(0).getUpdateMap()).containsEntry("41", "${TC1.11}");
        assertThat(cases.get(0).getValidateMap()).containsEntry("37", "${37}");
    }

    @Test
    void casesOfOneTemplateSharePatternCache() {
        List<ConcreteCase> cases = engine.expand(template("TC12", "35=D|54=1~2", "39=0"));

        assertThat(cases.get(0).getPatternCache()).isNotNull().isSameAs(cases.get(1).getPatternCache());
    }

    @Test
    void expandGroupsLeavesPlainFieldsAlone() {
        assertThat(engine.expandGroups("35=D|[1~2]=V|44=3")).isEqualTo("35=D|1=V|2=V|44=3");
        assertThat(engine.expandGroups("35=D")).isEqualTo("35=D");
    }

    private static CaseTemplate template(String testCaseId, String update, String validate) {
        return CaseTemplate.builder()
                .rowNumber(1)
                .useCaseId("UC1")
                .testCaseId(testCaseId)
                .baseMessage("8=FIX.4.4|35=D|55=MSFT")
                .updateSpec(update)
                .validateSpec(validate)
                .build();
    }
}
