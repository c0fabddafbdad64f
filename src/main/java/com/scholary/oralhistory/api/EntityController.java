package com.scholary.oralhistory.api;

import com.scholary.oralhistory.common.ProcessingResult;
import com.scholary.oralhistory.service.EntityResolutionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** REST API for resolving a story's location and organization mentions. */
@RestController
@Tag(name = "Entities", description = "Named-entity polishing and resolution per story")
public class EntityController {

  private final EntityResolutionService resolutionService;

  public EntityController(EntityResolutionService resolutionService) {
    this.resolutionService = resolutionService;
  }

  @PostMapping("/api/stories/{storyId}/entities/resolve")
  @Operation(
      summary = "Resolve entity candidates",
      description = "Resolve locations to USGS codes and organizations to LOC authority ids")
  public ResponseEntity<StoryResolutionResponse> resolve(
      @PathVariable String storyId, @Valid @RequestBody EntityResolutionRequest request) {
    return ResponseEntity.ok(resolutionService.resolveStory(storyId, request.candidates()));
  }

  @PostMapping("/api/stories/{storyId}/entities/polish")
  @Operation(
      summary = "Polish and resolve NER output",
      description =
          "Rebuild candidates from Stanford NER token lines, merge spaCy spans, then resolve them")
  public ResponseEntity<?> polishAndResolve(
      @PathVariable String storyId, @Valid @RequestBody PolishRequest request) {
    ProcessingResult<StoryResolutionResponse> result =
        resolutionService.polishAndResolve(
            storyId, request.tokenLines(), request.spacyLines(), request.transcript());
    if (!result.isSuccess()) {
      return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
          .body(new ErrorResponse(result.error()));
    }
    return ResponseEntity.ok(result.value());
  }
}
