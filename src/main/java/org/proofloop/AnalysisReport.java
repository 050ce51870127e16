package org.proofloop;

import org.proofloop.anchor.AnchorOccurrence;
import org.proofloop.flow.ProgramModel;
import org.proofloop.flow.UnresolvedReference;
import org.proofloop.hpg.HeterogeneousProgramGraph;
import org.proofloop.parse.SourceParseException;
import org.proofloop.parse.SourceUnit;
import org.proofloop.slice.Slice;

import java.util.List;

/**
 * 一次分析运行的完整结果：每个源码单元、每个锚点都有结论
 */
public record AnalysisReport(List<SourceUnit> units, List<SourceParseException> parseErrors,
                             List<AnchorOccurrence> anchors, List<Slice> slices, List<AnchorFailure> failures,
                             List<UnresolvedReference> warnings, ProgramModel model,
                             HeterogeneousProgramGraph graph) {
}
