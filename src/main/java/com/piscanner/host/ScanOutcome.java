package com.piscanner.host;

import java.nio.file.Path;
import java.util.List;

import com.piscanner.evaluation.EvaluationRecord;
import com.piscanner.report.ScanReport;

public record ScanOutcome(ScanReport summary, List<EvaluationRecord> records, Path reportDirectory) {
}
