package org.dxworks.fortframe.model.summary;

import org.approvaltests.Approvals;
import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.model.Project;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.dxworks.fortframe.TestUtils.APPROVAL_MAPPER;
import static org.dxworks.fortframe.TestUtils.loadSamples;

public class UnitSummaryApprovalTest {

    @Test
    void summarize_ConstantsModule() throws IOException {
        Project project = loadSamples(FortframeConfig.defaults(), "constants.f90");
        UnitSummary summary = SummaryBuilder.unit(project.findModule("constants"));
        Approvals.verify(APPROVAL_MAPPER.writeValueAsString(summary));
    }
}
