package com.example.file_registry.controller;

import com.example.file_registry.controller.dto.ConfirmUploadRequest;
import com.example.file_registry.controller.dto.FileResponse;
import com.example.file_registry.controller.dto.FileUploadRequest;
import com.example.file_registry.controller.dto.PrepareUploadRequest;
import com.example.file_registry.controller.dto.RegisterSourceRequest;
import com.example.file_registry.controller.dto.SearchResponse;
import com.example.file_registry.controller.dto.SourceResponse;
import com.example.file_registry.controller.dto.SourcesResponse;
import com.example.file_registry.controller.dto.UploadResponse;
import com.example.file_registry.model.FileRecord;
import com.example.file_registry.security.CallerContext;
import com.example.file_registry.service.RegisteredSource;
import com.example.file_registry.service.ScopedFileQueryService;
import com.example.file_registry.service.SourceProvisioningService;
import com.example.file_registry.service.SourceRegistry;
import com.example.file_registry.service.SourceSyncService;
import com.example.file_registry.service.UploadConfirmation;
import com.example.file_registry.service.UploadOrchestrator;
import com.example.file_registry.service.UploadOutcome;
import com.example.file_registry.service.UploadRequest;
import com.example.file_registry.util.FileMapper;
import jakarta.validation.Valid;
import java.net.URI;
import java.security.Principal;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/v1/sources")
public class SourceController {

  private final SourceRegistry sourceRegistry;
  private final SourceProvisioningService sourceProvisioningService;
  private final ScopedFileQueryService scopedFileQueryService;
  private final UploadOrchestrator uploadOrchestrator;
  private final SourceSyncService sourceSyncService;
  private final FileMapper fileMapper;

  public SourceController(
      SourceRegistry sourceRegistry,
      SourceProvisioningService sourceProvisioningService,
      ScopedFileQueryService scopedFileQueryService,
      UploadOrchestrator uploadOrchestrator,
      SourceSyncService sourceSyncService,
      FileMapper fileMapper) {
    this.sourceRegistry = sourceRegistry;
    this.sourceProvisioningService = sourceProvisioningService;
    this.scopedFileQueryService = scopedFileQueryService;
    this.uploadOrchestrator = uploadOrchestrator;
    this.sourceSyncService = sourceSyncService;
    this.fileMapper = fileMapper;
  }

  /** Sources the caller may see, plus every source that failed to start. */
  @GetMapping
  public ResponseEntity<SourcesResponse> listSources(
      @RequestHeader(name = "X-User-Id", required = false) String userId, Principal principal) {
    List<SourceResponse> sources =
        scopedFileQueryService.visibleSources(CallerContext.resolve(principal, userId)).stream()
            .map(fileMapper::toResponse)
            .collect(Collectors.toList());
    return ResponseEntity.ok(new SourcesResponse(sources, sourceRegistry.failures()));
  }

  @PostMapping
  public ResponseEntity<SourceResponse> registerSource(
      @Valid @RequestBody RegisterSourceRequest request) {
    RegisteredSource source =
        sourceProvisioningService.registerRuntimeSource(
            request.slug(), request.storage(), request.label(), request.config());
    return ResponseEntity.created(URI.create("/api/v1/sources/" + source.slug()))
        .body(fileMapper.toResponse(source));
  }

  @GetMapping("/{slug}/files")
  public ResponseEntity<SearchResponse> listFiles(
      @RequestHeader(name = "X-User-Id", required = false) String userId,
      Principal principal,
      @PathVariable String slug,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) String cursor) {
    return ResponseEntity.ok(
        fileMapper.toResponse(
            scopedFileQueryService.listSource(
                CallerContext.resolve(principal, userId), slug, limit, cursor)));
  }

  @PostMapping(value = "/{slug}/uploads", consumes = "multipart/form-data")
  public ResponseEntity<UploadResponse> uploadFile(
      @RequestHeader(name = "X-User-Id", required = false) String userId,
      Principal principal,
      @PathVariable String slug,
      @RequestPart("file") MultipartFile file,
      @RequestPart(name = "properties", required = false) FileUploadRequest properties) {
    CallerContext caller = CallerContext.resolve(principal, userId);
    scopedFileQueryService.requireSource(caller, slug);
    String filename =
        properties != null && properties.filename() != null
            ? properties.filename()
            : file.getOriginalFilename();
    UploadOutcome outcome =
        uploadOrchestrator.beginUpload(
            new UploadRequest(
                slug,
                filename,
                file.getContentType(),
                file.getSize(),
                file,
                caller.actorId(),
                properties == null ? null : properties.metadata()));
    return respond(outcome);
  }

  /** Asks where to send the bytes; sources that take content through the host reject this. */
  @PostMapping("/{slug}/uploads/prepare")
  public ResponseEntity<UploadResponse> prepareUpload(
      @RequestHeader(name = "X-User-Id", required = false) String userId,
      Principal principal,
      @PathVariable String slug,
      @Valid @RequestBody PrepareUploadRequest request) {
    CallerContext caller = CallerContext.resolve(principal, userId);
    scopedFileQueryService.requireSource(caller, slug);
    UploadOutcome outcome =
        uploadOrchestrator.beginUpload(
            new UploadRequest(
                slug,
                request.filename(),
                request.contentType(),
                request.size(),
                null,
                caller.actorId(),
                request.metadata(),
                request.contentHash()));
    return respond(outcome);
  }

  @PostMapping("/{slug}/uploads/{fileId}/confirm")
  public ResponseEntity<FileResponse> confirmUpload(
      @RequestHeader(name = "X-User-Id", required = false) String userId,
      Principal principal,
      @PathVariable String slug,
      @PathVariable String fileId,
      @Valid @RequestBody ConfirmUploadRequest request) {
    CallerContext caller = CallerContext.resolve(principal, userId);
    scopedFileQueryService.requireSource(caller, slug);
    FileRecord record =
        uploadOrchestrator.confirmUpload(
            new UploadConfirmation(
                slug, fileId, request.filename(), caller.actorId(), request.metadata()));
    FileResponse response = fileMapper.fromEntity(record);
    return ResponseEntity.created(URI.create(response.downloadLink())).body(response);
  }

  @PostMapping("/{slug}/sync")
  public ResponseEntity<SourceSyncService.SyncReport> sync(
      @RequestHeader(name = "X-User-Id", required = false) String userId,
      Principal principal,
      @PathVariable String slug) {
    scopedFileQueryService.requireSource(CallerContext.resolve(principal, userId), slug);
    return ResponseEntity.ok(sourceSyncService.sync(slug));
  }

  @PostMapping("/{slug}/reconcile")
  public ResponseEntity<SourceSyncService.ReconcileReport> reconcile(
      @RequestHeader(name = "X-User-Id", required = false) String userId,
      Principal principal,
      @PathVariable String slug) {
    scopedFileQueryService.requireSource(CallerContext.resolve(principal, userId), slug);
    return ResponseEntity.ok(sourceSyncService.reconcile(slug));
  }

  private ResponseEntity<UploadResponse> respond(UploadOutcome outcome) {
    UploadResponse response = fileMapper.toResponse(outcome);
    if (outcome.isPending()) {
      return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }
    return ResponseEntity.created(URI.create(response.file().downloadLink())).body(response);
  }
}
