package com.scholary.dubbing.api;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.dubbing.config.DubbingProperties;
import com.scholary.dubbing.config.TestProperties;
import com.scholary.dubbing.error.NotFoundException;
import com.scholary.dubbing.error.UpstreamException;
import com.scholary.dubbing.pipeline.DubbingOrchestrator;
import com.scholary.dubbing.pipeline.DubbingRequest;
import com.scholary.dubbing.pipeline.DubbingStatus;
import com.scholary.dubbing.session.SessionStatus;
import com.scholary.dubbing.synthesis.SpeechSynthesizer;
import com.scholary.dubbing.synthesis.VoiceOption;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(DubbingController.class)
@Import(DubbingControllerTest.PropertiesConfig.class)
class DubbingControllerTest {

  @TestConfiguration
  static class PropertiesConfig {
    @Bean
    DubbingProperties dubbingProperties() {
      return TestProperties.dubbing(Path.of(System.getProperty("java.io.tmpdir")));
    }
  }

  @Autowired private MockMvc mockMvc;

  @MockBean private DubbingOrchestrator orchestrator;

  @MockBean private SpeechSynthesizer synthesizer;

  @TempDir Path tempDir;

  @Test
  void submit_shouldAcceptAndReturnSessionId() throws Exception {
    when(orchestrator.submit(any(DubbingRequest.class))).thenReturn("s1");
    when(orchestrator.status("s1"))
        .thenReturn(
            new DubbingStatus("s1", SessionStatus.CREATED, 0, null, null, null, List.of()));

    mockMvc
        .perform(
            post("/api/dub")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"videoRef\":\"/videos/talk.mp4\",\"targetLanguage\":\"es\"}"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.sessionId").value("s1"))
        .andExpect(jsonPath("$.status").value("created"))
        .andExpect(jsonPath("$.progress").value(0));
  }

  @Test
  void submit_shouldRejectMissingTargetLanguage() throws Exception {
    mockMvc
        .perform(
            post("/api/dub")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"videoRef\":\"/videos/talk.mp4\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value("InvalidRequest"))
        .andExpect(jsonPath("$.message").value(containsString("targetLanguage")));

    verifyNoInteractions(orchestrator);
  }

  @Test
  void status_shouldExposeResultReferencesWhenCompleted() throws Exception {
    when(orchestrator.status("s1"))
        .thenReturn(
            new DubbingStatus(
                "s1",
                SessionStatus.COMPLETED,
                100,
                "/api/dub/s1/video",
                "/api/dub/s1/download",
                null,
                List.of()));

    mockMvc
        .perform(get("/api/dub/s1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("completed"))
        .andExpect(jsonPath("$.videoRef").value("/api/dub/s1/video"))
        .andExpect(jsonPath("$.error").doesNotExist());
  }

  @Test
  void status_shouldReturnNotFoundForUnknownSession() throws Exception {
    when(orchestrator.status("nope")).thenThrow(new NotFoundException("Session not found: nope"));

    mockMvc
        .perform(get("/api/dub/nope"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.errorCode").value("NotFound"))
        .andExpect(jsonPath("$.message").value("Session not found: nope"));
  }

  @Test
  void download_shouldServeVideoAsAttachment() throws Exception {
    Path video = Files.write(tempDir.resolve("final_video.mp4"), new byte[] {1, 2, 3});
    when(orchestrator.resultVideo("s1")).thenReturn(video);

    mockMvc
        .perform(get("/api/dub/s1/download"))
        .andExpect(status().isOk())
        .andExpect(content().contentType("video/mp4"))
        .andExpect(header().string("Content-Disposition", containsString("attachment")))
        .andExpect(header().string("Content-Disposition", containsString("dubbed_s1.mp4")))
        .andExpect(content().bytes(new byte[] {1, 2, 3}));
  }

  @Test
  void video_shouldReturnNotFoundBeforeCompletion() throws Exception {
    when(orchestrator.resultVideo("s1"))
        .thenThrow(new NotFoundException("Dubbed video not available for session: s1"));

    mockMvc.perform(get("/api/dub/s1/video")).andExpect(status().isNotFound());
  }

  @Test
  void languages_shouldListSupportedLanguages() throws Exception {
    mockMvc
        .perform(get("/api/languages"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(21))
        .andExpect(jsonPath("$[0].code").value("es"))
        .andExpect(jsonPath("$[0].name").value("Spanish"));
  }

  @Test
  void voices_shouldPutCloneOptionFirst() throws Exception {
    when(synthesizer.listVoices())
        .thenReturn(List.of(new VoiceOption("v1", "Rachel", "", "premade", "", "female", "")));

    mockMvc
        .perform(get("/api/voices"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[0].id").value("clone"))
        .andExpect(jsonPath("$[1].id").value("v1"));
  }

  @Test
  void voices_shouldFallBackToDefaultVoiceWhenProviderFails() throws Exception {
    when(synthesizer.listVoices())
        .thenThrow(new UpstreamException("elevenlabs", "ELEVENLABS_API_KEY is not configured"));

    mockMvc
        .perform(get("/api/voices"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[0].id").value("clone"))
        .andExpect(jsonPath("$[1].id").value("default-voice"));
  }
}
