package org.dxworks.cteframe;

import org.approvaltests.Approvals;
import org.dxworks.cteframe.model.SliceReport;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

public class AppAnalyzeFileApprovalTest {

    private static final Path ORDERS = Paths.get("src/test/resources/samples/orders.sql");
    private static final Path PLAIN = Paths.get("src/test/resources/samples/plain.sql");

    // "FROM user_orders" in the main query
    private static final int CARET_IN_MAIN_QUERY = 209;
    // "orders o" inside the user_orders body
    private static final int CARET_IN_CTE_BODY = 126;

    @Test
    void analyze_FromHere_MainQuery() throws IOException {
        verify(ORDERS, CARET_IN_MAIN_QUERY, ActionMode.FROM_HERE);
    }

    @Test
    void analyze_Run_InsideCteBody() throws IOException {
        verify(ORDERS, CARET_IN_CTE_BODY, ActionMode.RUN);
    }

    @Test
    void analyze_Edit_InsideCteBody() throws IOException {
        verify(ORDERS, CARET_IN_CTE_BODY, ActionMode.EDIT);
    }

    @Test
    void analyze_Run_WithoutWithClause() throws IOException {
        verify(PLAIN, 0, ActionMode.RUN);
    }

    private static void verify(Path file, int caretOffset, ActionMode mode) throws IOException {
        SliceReport report = App.analyzeFile(file, caretOffset, mode, CteframeConfig.defaults());
        Approvals.verify(TestUtils.APPROVAL_MAPPER.writeValueAsString(report));
    }
}
