package com.scholary.dubbing.api;

import com.scholary.dubbing.config.DubbingProperties;
import com.scholary.dubbing.error.DubbingException;
import com.scholary.dubbing.pipeline.DubbingOrchestrator;
import com.scholary.dubbing.pipeline.DubbingRequest;
import com.scholary.dubbing.pipeline.DubbingStatus;
import com.scholary.dubbing.synthesis.SpeechSynthesizer;
import com.scholary.dubbing.synthesis.VoiceOption;
import com.scholary.dubbing.synthesis.VoiceResolver;
import com.scholary.dubbing.translation.SupportedLanguages;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for video dubbing.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Submitting a dubbing job (returns a session id immediately)
 *   <li>Session status polling
 *   <li>Streaming or downloading the dubbed video
 *   <li>Listing target languages and voices
 * </ul>
 */
@RestController
@Tag(name = "Dubbing", description = "Video dubbing API")
public class DubbingController {

  private static final Logger LOGGER = LoggerFactory.getLogger(DubbingController.class);
  private static final MediaType VIDEO_MP4 = MediaType.parseMediaType("video/mp4");

  private final DubbingOrchestrator orchestrator;
  private final SpeechSynthesizer synthesizer;
  private final DubbingProperties properties;

  public DubbingController(
      DubbingOrchestrator orchestrator,
      SpeechSynthesizer synthesizer,
      DubbingProperties properties) {
    this.orchestrator = orchestrator;
    this.synthesizer = synthesizer;
    this.properties = properties;
  }

  @PostMapping("/api/dub")
  @Operation(
      summary = "Start dubbing",
      description = "Start an asynchronous dubbing job and return the session id for polling")
  public ResponseEntity<SubmitResponse> submit(@Valid @RequestBody DubbingRequest request) {
    String sessionId = orchestrator.submit(request);
    return ResponseEntity.accepted().body(SubmitResponse.of(orchestrator.status(sessionId)));
  }

  @GetMapping("/api/dub/{id}")
  @Operation(summary = "Get session status", description = "Check the progress of a dubbing job")
  public DubbingStatus status(@PathVariable String id) {
    return orchestrator.status(id);
  }

  @GetMapping("/api/dub/{id}/video")
  @Operation(summary = "Stream dubbed video", description = "Serve the dubbed video inline")
  public ResponseEntity<Resource> video(@PathVariable String id) {
    return videoResponse(id, ContentDisposition.inline());
  }

  @GetMapping("/api/dub/{id}/download")
  @Operation(summary = "Download dubbed video", description = "Serve the dubbed video as a file")
  public ResponseEntity<Resource> download(@PathVariable String id) {
    return videoResponse(id, ContentDisposition.attachment());
  }

  @GetMapping("/api/languages")
  @Operation(summary = "List target languages")
  public List<LanguageOption> languages() {
    return SupportedLanguages.all().entrySet().stream()
        .map(entry -> new LanguageOption(entry.getKey(), entry.getValue()))
        .toList();
  }

  /**
   * List selectable voices, with the clone option first.
   *
   * <p>If the provider can't be reached, only the clone option and the default stock voice are
   * offered.
   */
  @GetMapping("/api/voices")
  @Operation(summary = "List voices")
  public List<VoiceOption> voices() {
    List<VoiceOption> voices = new ArrayList<>();
    voices.add(
        new VoiceOption(
            VoiceResolver.CLONE_OPTION,
            "Clone original voice",
            "Speak with a clone of the video's speaker",
            "cloned",
            "",
            "",
            ""));
    try {
      voices.addAll(synthesizer.listVoices());
    } catch (DubbingException e) {
      LOGGER.warn("Voice list unavailable, offering defaults: {}", e.getMessage());
      voices.add(
          new VoiceOption(
              properties.voice().defaultVoiceId(),
              "Default voice",
              "Stock multilingual voice",
              "premade",
              "",
              "",
              ""));
    }
    return voices;
  }

  private ResponseEntity<Resource> videoResponse(String id, ContentDisposition.Builder disposition) {
    Path video = orchestrator.resultVideo(id);
    return ResponseEntity.ok()
        .contentType(VIDEO_MP4)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            disposition.filename("dubbed_" + id + ".mp4").build().toString())
        .body(new FileSystemResource(video));
  }
}
