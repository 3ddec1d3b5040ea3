package io.github.graydavid.conga.core;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

public class ConstraintReportTest {
    private final Diagnostic warning = Diagnostic.of(Diagnostic.Kind.UNKNOWN_NODE, "y", "skipped y", 2);
    private final Diagnostic violation = Diagnostic.of(Diagnostic.Kind.FAILED_ASSERTION, "a", "a failed", 1, 2);
    private final Diagnostic error = Diagnostic.of(Diagnostic.Kind.EMPTY_GRAPH, "nothing to run");

    @Test
    public void reportWithoutDiagnosticsIsSatisfied() {
        ConstraintReport report = ConstraintReport.from(List.of());

        assertTrue(report.isSatisfied());
        assertThat(report.getDiagnostics(), empty());
    }

    @Test
    public void warningsAloneDoNotMakeReportUnsatisfied() {
        assertTrue(ConstraintReport.from(List.of(warning)).isSatisfied());
    }

    @Test
    public void violationsAndErrorsMakeReportUnsatisfied() {
        assertFalse(ConstraintReport.from(List.of(warning, violation)).isSatisfied());
        assertFalse(ConstraintReport.from(List.of(error)).isSatisfied());
    }

    @Test
    public void getDiagnosticsFiltersByKindAndKeepsOrder() {
        ConstraintReport report = ConstraintReport.from(List.of(violation, warning, error));

        assertThat(report.getDiagnostics(), contains(violation, warning, error));
        assertThat(report.getDiagnostics(Diagnostic.Kind.FAILED_ASSERTION), contains(violation));
        assertThat(report.getDiagnostics(Diagnostic.Kind.VALUE_MISMATCH), empty());
    }

    @Test
    public void diagnosticsKnowTheirSeverityAndNode() {
        assertThat(warning.getSeverity(), is(Diagnostic.Severity.WARNING));
        assertThat(violation.getSeverity(), is(Diagnostic.Severity.VIOLATION));
        assertThat(error.getSeverity(), is(Diagnostic.Severity.ERROR));
        assertThat(violation.getNodeLabel().get(), is("a"));
        assertFalse(error.getNodeLabel().isPresent());
        assertThat(error.getValues(), empty());
    }

    @Test
    public void diagnosticsAllowMissingValues() {
        Diagnostic mismatch = Diagnostic.of(Diagnostic.Kind.VALUE_MISMATCH, "y", "no value", 5, null);

        assertThat(mismatch.getValues(), contains((Object) 5, null));
    }

    @Test
    public void diagnosticsWithSameContentAreEqual() {
        Diagnostic copy = Diagnostic.of(Diagnostic.Kind.FAILED_ASSERTION, "a", "a failed", 1, 2);

        assertThat(copy, is(violation));
        assertThat(copy.hashCode(), is(violation.hashCode()));
        assertThat(copy.toString(), containsString("a failed"));
    }
}
