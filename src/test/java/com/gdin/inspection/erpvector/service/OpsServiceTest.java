package com.gdin.inspection.erpvector.service;

import com.gdin.inspection.erpvector.exception.ClearDataRefusedException;
import com.gdin.inspection.erpvector.filter.FilterClause;
import com.gdin.inspection.erpvector.filter.NativeFilter;
import com.gdin.inspection.erpvector.integrity.FixOrphansResult;
import com.gdin.inspection.erpvector.integrity.FkGraphIntegrityEngine;
import com.gdin.inspection.erpvector.integrity.OrphanRepairService;
import com.gdin.inspection.erpvector.integrity.ValidationOptions;
import com.gdin.inspection.erpvector.integrity.ValidationRunReport;
import com.gdin.inspection.erpvector.query.OperationControl;
import com.gdin.inspection.erpvector.req.ClearDataReq;
import com.gdin.inspection.erpvector.req.FixOrphansReq;
import com.gdin.inspection.erpvector.req.ValidateFkReq;
import com.gdin.inspection.erpvector.resp.ClearDataResp;
import com.gdin.inspection.erpvector.store.PointPayload;
import com.gdin.inspection.erpvector.store.VectorStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class OpsServiceTest {

    @Mock
    private VectorStore vectorStore;
    @Mock
    private FkGraphIntegrityEngine fkGraphIntegrityEngine;
    @Mock
    private OrphanRepairService orphanRepairService;
    @InjectMocks
    private OpsService opsService;

    @Test
    void clearDataRequiresDryRunOrConfirm() {
        assertThrows(ClearDataRefusedException.class, () -> opsService.clearData(new ClearDataReq()));
        verifyNoInteractions(vectorStore);
    }

    @Test
    void dryRunOnlyCounts() {
        when(vectorStore.count(any(NativeFilter.class), eq(true))).thenReturn(12L, 4L);
        ClearDataReq req = ClearDataReq.builder().dryRun(true).model("res.partner").build();

        ClearDataResp resp = opsService.clearData(req);
        assertEquals(12, resp.getDataPoints());
        assertEquals(4, resp.getGraphPoints());
        assertEquals(0, resp.getDeleted());
        verify(vectorStore, never()).deleteByFilter(any());

        ArgumentCaptor<NativeFilter> filters = ArgumentCaptor.forClass(NativeFilter.class);
        verify(vectorStore, times(2)).count(filters.capture(), eq(true));
        NativeFilter data = filters.getAllValues().get(0);
        assertTrue(data.getClauses().contains(FilterClause.eq(PointPayload.POINT_TYPE, "data")));
        assertTrue(data.getClauses().contains(FilterClause.eq(PointPayload.MODEL_NAME, "res.partner")));
    }

    @Test
    void confirmedClearDeletesDataAndGraph() {
        when(vectorStore.count(any(NativeFilter.class), eq(true))).thenReturn(3L, 2L);
        when(vectorStore.deleteByFilter(any(NativeFilter.class))).thenReturn(3L, 2L);
        ClearDataResp resp = opsService.clearData(ClearDataReq.builder().confirm(true).build());
        assertEquals(5, resp.getDeleted());
        verify(vectorStore, times(2)).deleteByFilter(any(NativeFilter.class));
    }

    @Test
    void unknownDeleteCountIsReportedAsMinusOne() {
        when(vectorStore.count(any(NativeFilter.class), eq(true))).thenReturn(3L, 2L);
        when(vectorStore.deleteByFilter(any(NativeFilter.class))).thenReturn(-1L, 2L);
        assertEquals(-1, opsService.clearData(ClearDataReq.builder().confirm(true).build()).getDeleted());
    }

    @Test
    void validateFkMapsAutoSyncToRepair() {
        ValidationRunReport report = ValidationRunReport.builder().build();
        when(fkGraphIntegrityEngine.validate(any(ValidationOptions.class), any(OperationControl.class))).thenReturn(report);
        ValidateFkReq req = new ValidateFkReq();
        req.setModels(List.of("account.move.line"));
        req.setAutoSync(true);
        req.setOrphanLimit(7);

        assertSame(report, opsService.validateFk(req));
        ArgumentCaptor<ValidationOptions> options = ArgumentCaptor.forClass(ValidationOptions.class);
        verify(fkGraphIntegrityEngine).validate(options.capture(), any(OperationControl.class));
        assertTrue(options.getValue().isAutoRepair());
        assertEquals(7, options.getValue().getOrphanLimit());
        assertFalse(options.getValue().isFix());
    }

    @Test
    void fixOrphansRunsUnderTheRequestedTimeout() {
        FixOrphansResult result = FixOrphansResult.builder().build();
        when(orphanRepairService.fixOrphans(any(), any(OperationControl.class))).thenReturn(result);
        FixOrphansReq req = FixOrphansReq.builder().models(List.of("account.move.line")).timeoutMillis(30_000L).build();

        assertSame(result, opsService.fixOrphans(req));
        ArgumentCaptor<OperationControl> control = ArgumentCaptor.forClass(OperationControl.class);
        verify(orphanRepairService).fixOrphans(eq(List.of("account.move.line")), control.capture());
        long remaining = control.getValue().remainingMillis();
        assertTrue(remaining > 0 && remaining <= 30_000L);
    }
}
