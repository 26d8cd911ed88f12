package com.example.mediacatalog_backend.controller;

import com.example.mediacatalog_backend.config.AppPropertiesConfig;
import com.example.mediacatalog_backend.dto.FlowSegmentDTO;
import com.example.mediacatalog_backend.exception.CatalogException;
import com.example.mediacatalog_backend.model.Flow;
import com.example.mediacatalog_backend.model.FlowSegment;
import com.example.mediacatalog_backend.service.FlowService;
import com.example.mediacatalog_backend.service.MediaObjectService;
import com.example.mediacatalog_backend.service.SegmentIndexService;
import com.example.mediacatalog_backend.timerange.TimePoint;
import com.example.mediacatalog_backend.timerange.TimeRange;
import com.example.mediacatalog_backend.util.ContentFormat;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = FlowController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(AppPropertiesConfig.class)
class FlowControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private FlowService flowService;

    @MockitoBean
    private SegmentIndexService segmentIndex;

    @MockitoBean
    private MediaObjectService mediaObjects;

    @Test
    void addSegmentReturnsCreatedSegmentInSnakeCase() throws Exception {
        UUID flowId = UUID.randomUUID();
        FlowSegment segment = new FlowSegment(new Flow(ContentFormat.VIDEO), "obj-1", TimeRange.parse("[0:0_10:0)"));
        segment.setTsOffset(TimePoint.parse("0:0"));
        segment.setSampleCount(250L);
        when(segmentIndex.insert(eq(flowId), any(FlowSegmentDTO.class), eq(false))).thenReturn(segment);

        mockMvc.perform(post("/flows/{id}/segments", flowId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"object_id\":\"obj-1\",\"timerange\":\"[0:0_10:0)\",\"ts_offset\":\"0:0\",\"sample_count\":250}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.object_id").value("obj-1"))
                .andExpect(jsonPath("$.timerange").value("[0:0_10:0)"))
                .andExpect(jsonPath("$.ts_offset").value("0:0"))
                .andExpect(jsonPath("$.sample_count").value(250));

        ArgumentCaptor<FlowSegmentDTO> dto = ArgumentCaptor.forClass(FlowSegmentDTO.class);
        verify(segmentIndex).insert(eq(flowId), dto.capture(), eq(false));
        assertThat(dto.getValue().timerange()).isEqualTo(TimeRange.parse("[0:0_10:0)"));
    }

    @Test
    void overlappingSegmentIsConflict() throws Exception {
        UUID flowId = UUID.randomUUID();
        when(segmentIndex.insert(eq(flowId), any(FlowSegmentDTO.class), anyBoolean()))
                .thenThrow(CatalogException.overlap("SEGMENT_OVERLAP"));

        mockMvc.perform(post("/flows/{id}/segments", flowId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"object_id\":\"obj-2\",\"timerange\":\"[5:0_15:0)\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("SEGMENT_OVERLAP"))
                .andExpect(jsonPath("$.kind").value("OVERLAP_CONFLICT"))
                .andExpect(jsonPath("$.status").value(409));
    }

    @Test
    void segmentWithoutObjectIdIsRejected() throws Exception {
        mockMvc.perform(post("/flows/{id}/segments", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"timerange\":\"[0:0_1:0)\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_OBJECTID"));
    }

    @Test
    void malformedTimerangeQueryIsParseError() throws Exception {
        mockMvc.perform(get("/flows/{id}/segments", UUID.randomUUID()).param("timerange", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_TIMERANGE"))
                .andExpect(jsonPath("$.kind").value("PARSE_ERROR"));

        verify(segmentIndex, never()).query(any(), any(), any(), anyInt());
    }

    @Test
    void segmentQueryReturnsNextPageCursor() throws Exception {
        UUID flowId = UUID.randomUUID();
        FlowSegment segment = new FlowSegment(new Flow(ContentFormat.AUDIO), "obj-1", TimeRange.parse("[0:0_1:0)"));
        when(segmentIndex.query(flowId, null, null, 1))
                .thenReturn(new SegmentIndexService.SegmentPage(List.of(segment), "[0:0_1:0)"));

        mockMvc.perform(get("/flows/{id}/segments", flowId).param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.segments[0].object_id").value("obj-1"))
                .andExpect(jsonPath("$.limit").value(1))
                .andExpect(jsonPath("$.next_page").value("[0:0_1:0)"));
    }

    @Test
    void deleteWithoutTimerangeClearsWholeFlow() throws Exception {
        UUID flowId = UUID.randomUUID();
        when(segmentIndex.deleteRange(flowId, TimeRange.ETERNITY)).thenReturn(new SegmentIndexService.DeleteResult(3, 0));

        mockMvc.perform(delete("/flows/{id}/segments", flowId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.flow_id").value(flowId.toString()))
                .andExpect(jsonPath("$.timerange").value("(_)"))
                .andExpect(jsonPath("$.deleted").value(3))
                .andExpect(jsonPath("$.modified").value(0));
    }

    @Test
    void storageAllocationOnReadOnlyFlowIsForbidden() throws Exception {
        UUID flowId = UUID.randomUUID();
        Flow flow = new Flow(ContentFormat.VIDEO);
        flow.setReadOnly(true);
        when(flowService.get(flowId)).thenReturn(flow);

        mockMvc.perform(post("/flows/{id}/storage", flowId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"limit\":2}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("FLOW_READ_ONLY"));

        verify(mediaObjects, never()).allocate(any(), anyInt());
    }

    @Test
    void unknownFlowIsNotFound() throws Exception {
        UUID flowId = UUID.randomUUID();
        when(flowService.get(flowId)).thenThrow(CatalogException.notFound("FLOW_NOT_FOUND"));

        mockMvc.perform(get("/flows/{id}", flowId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"));
    }

    @Test
    void unsupportedFormatInBodyIsParseError() throws Exception {
        mockMvc.perform(post("/flows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"format\":\"urn:x-nmos:format:smell\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("UNSUPPORTED_FORMAT"));
    }

    @Test
    void flowIsSerializedWithFormatUrn() throws Exception {
        UUID flowId = UUID.randomUUID();
        Flow flow = new Flow(ContentFormat.VIDEO);
        flow.setLabel("camera-1");
        when(flowService.get(flowId)).thenReturn(flow);

        mockMvc.perform(get("/flows/{id}", flowId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.format").value("urn:x-nmos:format:video"))
                .andExpect(jsonPath("$.label").value("camera-1"))
                .andExpect(jsonPath("$.read_only").value(false));
    }
}
