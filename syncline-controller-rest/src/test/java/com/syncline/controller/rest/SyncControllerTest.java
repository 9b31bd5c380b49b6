package com.syncline.controller.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.syncline.service.core.ack.SyncAckService;
import com.syncline.service.core.ack.SyncAckView;
import com.syncline.service.core.ack.SyncResetService;
import com.syncline.service.core.error.SyncProtocolException;
import com.syncline.service.core.error.SyncProtocolException.RejectedItem;
import com.syncline.service.core.legacy.LegacyAssetSyncService;
import com.syncline.service.core.model.SyncAuth;
import com.syncline.service.core.model.SyncRequestType;
import com.syncline.service.core.model.SyncStreamLine;
import com.syncline.service.core.model.VersionToken;
import com.syncline.service.core.stream.SyncStreamOutcome;
import com.syncline.service.core.stream.SyncStreamRequest;
import com.syncline.service.core.stream.SyncStreamService;
import com.syncline.service.core.stream.SyncStreamSink;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.http.converter.json.ProblemDetailJacksonMixin;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class SyncControllerTest {

    private static final String TOKEN = "0195f2a0-0000-7000-8000-000000000000";

    private final SyncStreamService streamService = Mockito.mock(SyncStreamService.class);
    private final SyncAckService ackService = Mockito.mock(SyncAckService.class);
    private final SyncResetService resetService = Mockito.mock(SyncResetService.class);
    private final LegacyAssetSyncService legacyService = Mockito.mock(LegacyAssetSyncService.class);

    private final UUID user = UUID.randomUUID();
    private final UUID session = UUID.randomUUID();
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = Jackson2ObjectMapperBuilder.json()
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .mixIn(ProblemDetail.class, ProblemDetailJacksonMixin.class)
                .build();
        SyncController controller =
                new SyncController(streamService, ackService, resetService, legacyService, mapper);
        mvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new RestErrorHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(mapper))
                .build();
    }

    @Test
    void streamWritesOneJsonLinePerEvent() throws Exception {
        Mockito.when(streamService.stream(Mockito.any(), Mockito.any(), Mockito.any()))
                .thenAnswer(inv -> {
                    SyncStreamSink sink = inv.getArgument(2);
                    sink.send(SyncStreamLine.reset());
                    sink.send(SyncStreamLine.complete(VersionToken.parse(TOKEN)));
                    return SyncStreamOutcome.RESET;
                });

        MvcResult started = mvc.perform(post("/api/sync/stream")
                        .header(SyncController.USER_HEADER, user)
                        .header(SyncController.SESSION_HEADER, session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"types\":[\"AlbumsV1\",\"UsersV1\"]}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andExpect(content().contentType(SyncController.NDJSON))
                .andExpect(content().string(
                        "{\"type\":\"SyncResetV1\",\"data\":{},\"ack\":\"SyncResetV1|reset\"}\n"
                                + "{\"type\":\"SyncCompleteV1\",\"data\":{},\"ack\":\"SyncCompleteV1|" + TOKEN
                                + "\"}\n"));

        ArgumentCaptor<SyncStreamRequest> request = ArgumentCaptor.forClass(SyncStreamRequest.class);
        Mockito.verify(streamService).stream(Mockito.eq(new SyncAuth(user, session)), request.capture(), Mockito.any());
        assertThat(request.getValue().types())
                .containsExactly(SyncRequestType.UsersV1, SyncRequestType.AlbumsV1);
    }

    @Test
    void streamWithoutSessionIsForbidden() throws Exception {
        mvc.perform(post("/api/sync/stream")
                        .header(SyncController.USER_HEADER, user)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"types\":[\"AssetsV1\"]}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("session_required"));

        Mockito.verifyNoInteractions(streamService);
    }

    @Test
    void streamWithUnknownTypeIsRejected() throws Exception {
        mvc.perform(post("/api/sync/stream")
                        .header(SyncController.USER_HEADER, user)
                        .header(SyncController.SESSION_HEADER, session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"types\":[\"PhotosV1\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.rejected[0].value").value("PhotosV1"));
    }

    @Test
    void streamWithoutTypesFailsValidation() throws Exception {
        mvc.perform(post("/api/sync/stream")
                        .header(SyncController.USER_HEADER, user)
                        .header(SyncController.SESSION_HEADER, session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"types\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"));
    }

    @Test
    void missingUserHeaderIsUnauthenticated() throws Exception {
        mvc.perform(get("/api/sync/ack")).andExpect(status().isUnauthorized());
    }

    @Test
    void listsStoredAcks() throws Exception {
        Mockito.when(ackService.getAcks(new SyncAuth(user, session)))
                .thenReturn(List.of(new SyncAckView("AssetV1", "AssetV1|" + TOKEN)));

        mvc.perform(get("/api/sync/ack")
                        .header(SyncController.USER_HEADER, user)
                        .header(SyncController.SESSION_HEADER, session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].type").value("AssetV1"))
                .andExpect(jsonPath("$[0].ack").value("AssetV1|" + TOKEN));
    }

    @Test
    void rejectedAcksAreListedInProblem() throws Exception {
        Mockito.when(ackService.setAcks(Mockito.any(), Mockito.anyList()))
                .thenThrow(new SyncProtocolException(
                        "Rejected 1 of 2 acks", List.of(new RejectedItem("AlbumV1|bad", "bad token"))));

        mvc.perform(post("/api/sync/ack")
                        .header(SyncController.USER_HEADER, user)
                        .header(SyncController.SESSION_HEADER, session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"acks\":[\"AssetV1|" + TOKEN + "\",\"AlbumV1|bad\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.rejected[0].value").value("AlbumV1|bad"))
                .andExpect(jsonPath("$.rejected[0].reason").value("bad token"));
    }

    @Test
    void deleteWithoutBodyResetsEverything() throws Exception {
        mvc.perform(delete("/api/sync/ack")
                        .header(SyncController.USER_HEADER, user)
                        .header(SyncController.SESSION_HEADER, session))
                .andExpect(status().isNoContent());

        Mockito.verify(resetService).reset(new SyncAuth(user, session), null);
    }

    @Test
    void deleteWithTypesResetsThoseOnly() throws Exception {
        mvc.perform(delete("/api/sync/ack")
                        .header(SyncController.USER_HEADER, user)
                        .header(SyncController.SESSION_HEADER, session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"types\":[\"AssetsV1\"]}"))
                .andExpect(status().isNoContent());

        Mockito.verify(resetService).reset(new SyncAuth(user, session), List.of("AssetsV1"));
    }
}
