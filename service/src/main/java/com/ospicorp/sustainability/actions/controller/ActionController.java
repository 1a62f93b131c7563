package com.ospicorp.sustainability.actions.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.ospicorp.sustainability.actions.model.Action;
import com.ospicorp.sustainability.actions.model.ActionPayload;
import com.ospicorp.sustainability.actions.service.ActionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@RestController
@RequestMapping({"/actions", "/api/actions"})
@Tag(name = "Actions")
public class ActionController {
  private static final String ITEM = "/{id:\\d+}";
  private static final String ITEM_SLASH = "/{id:\\d+}/";

  private final ActionService service;
  private final ActionPayloadReader reader;

  public ActionController(ActionService service, ActionPayloadReader reader) {
    this.service = service;
    this.reader = reader;
  }

  @GetMapping({"/", ""})
  @Operation(summary = "List actions", description = "Return every stored sustainability action.")
  @ApiResponse(responseCode = "200", description = "All actions",
      content = @Content(mediaType = "application/json",
          array = @ArraySchema(schema = @Schema(implementation = Action.class))))
  public List<Action> list() {
    return service.list();
  }

  @PostMapping({"/", ""})
  @Operation(summary = "Create an action", description = "Validate and store a new action.")
  @ApiResponses({
      @ApiResponse(responseCode = "201", description = "Created action",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = Action.class))),
      @ApiResponse(responseCode = "400",
          description = "Field validation errors, keyed by field name")
  })
  public ResponseEntity<Action> create(
      @io.swagger.v3.oas.annotations.parameters.RequestBody(content = @Content(
          mediaType = "application/json", schema = @Schema(implementation = ActionPayload.class)))
      @RequestBody(required = false) JsonNode body) {
    Action created = service.create(reader.read(body));
    var location = ServletUriComponentsBuilder.fromCurrentRequestUri()
        .pathSegment(String.valueOf(created.id()))
        .path("/")
        .build()
        .toUri();
    return ResponseEntity.status(HttpStatus.CREATED).location(location).body(created);
  }

  @GetMapping({ITEM_SLASH, ITEM})
  @Operation(summary = "Get an action")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "The action",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = Action.class))),
      @ApiResponse(responseCode = "404", description = "Not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public Action get(@PathVariable @Parameter(description = "Action id", example = "1") long id) {
    return service.get(id);
  }

  @PutMapping({ITEM_SLASH, ITEM})
  @Operation(summary = "Replace an action", description = "Every field must be supplied.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Updated action",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = Action.class))),
      @ApiResponse(responseCode = "400", description = "Field validation errors or failed update"),
      @ApiResponse(responseCode = "404", description = "Not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public Action replace(@PathVariable @Parameter(description = "Action id", example = "1") long id,
      @io.swagger.v3.oas.annotations.parameters.RequestBody(content = @Content(
          mediaType = "application/json", schema = @Schema(implementation = ActionPayload.class)))
      @RequestBody(required = false) JsonNode body) {
    return service.replace(id, reader.read(body));
  }

  @PatchMapping({ITEM_SLASH, ITEM})
  @Operation(summary = "Patch an action", description = "Only the supplied fields are changed.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Merged action",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = Action.class))),
      @ApiResponse(responseCode = "400", description = "Field validation errors or failed update"),
      @ApiResponse(responseCode = "404", description = "Not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public Action patch(@PathVariable @Parameter(description = "Action id", example = "1") long id,
      @io.swagger.v3.oas.annotations.parameters.RequestBody(content = @Content(
          mediaType = "application/json", schema = @Schema(implementation = ActionPayload.class)))
      @RequestBody(required = false) JsonNode body) {
    return service.patch(id, reader.read(body));
  }

  @DeleteMapping({ITEM_SLASH, ITEM})
  @Operation(summary = "Delete an action", description = "Succeeds whether or not the action exists.")
  @ApiResponse(responseCode = "204", description = "Deleted")
  public ResponseEntity<Void> delete(
      @PathVariable @Parameter(description = "Action id", example = "1") long id) {
    service.remove(id);
    return ResponseEntity.noContent().build();
  }
}
