package com.example.file_registry.controller;

import com.example.file_registry.controller.dto.AnnotationUpdateRequest;
import com.example.file_registry.controller.dto.FileResponse;
import com.example.file_registry.controller.dto.SearchResponse;
import com.example.file_registry.model.FileRecord;
import com.example.file_registry.security.CallerContext;
import com.example.file_registry.service.DownloadResolution;
import com.example.file_registry.service.DownloadResolver;
import com.example.file_registry.service.FileLifecycleService;
import com.example.file_registry.service.ScopedFileQueryService;
import com.example.file_registry.util.FileMapper;
import com.example.file_registry.util.FileReferences;
import jakarta.validation.Valid;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.Principal;
import java.util.List;
import org.springframework.core.io.InputStreamResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/files")
public class FileController {

  private final ScopedFileQueryService scopedFileQueryService;
  private final DownloadResolver downloadResolver;
  private final FileLifecycleService fileLifecycleService;
  private final FileMapper fileMapper;

  public FileController(
      ScopedFileQueryService scopedFileQueryService,
      DownloadResolver downloadResolver,
      FileLifecycleService fileLifecycleService,
      FileMapper fileMapper) {
    this.scopedFileQueryService = scopedFileQueryService;
    this.downloadResolver = downloadResolver;
    this.fileLifecycleService = fileLifecycleService;
    this.fileMapper = fileMapper;
  }

  @GetMapping("/{fileId}")
  public ResponseEntity<FileResponse> getFile(
      @RequestHeader(name = "X-User-Id", required = false) String userId,
      Principal principal,
      @PathVariable String fileId) {
    FileRecord record =
        scopedFileQueryService.get(CallerContext.resolve(principal, userId), fileId);
    return ResponseEntity.ok(fileMapper.fromEntity(record));
  }

  /**
   * Batch lookup; each {@code ids} value is a single id or a JSON array of ids. The raw values are
   * read from the parameter map so that commas inside an array are not split.
   */
  @GetMapping(params = "ids")
  public ResponseEntity<List<FileResponse>> getFiles(
      @RequestHeader(name = "X-User-Id", required = false) String userId,
      Principal principal,
      @RequestParam MultiValueMap<String, String> params) {
    List<FileRecord> records =
        scopedFileQueryService.getMany(
            CallerContext.resolve(principal, userId), FileReferences.parseAll(params.get("ids")));
    return ResponseEntity.ok(fileMapper.fromEntities(records));
  }

  @GetMapping("/search")
  public ResponseEntity<SearchResponse> search(
      @RequestHeader(name = "X-User-Id", required = false) String userId,
      Principal principal,
      @RequestParam(name = "q", required = false) String query,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) String cursor) {
    return ResponseEntity.ok(
        fileMapper.toResponse(
            scopedFileQueryService.search(
                CallerContext.resolve(principal, userId), query, limit, cursor)));
  }

  @GetMapping("/{fileId}/download")
  public ResponseEntity<Resource> downloadFile(
      @RequestHeader(name = "X-User-Id", required = false) String userId,
      Principal principal,
      @PathVariable String fileId) {
    FileRecord record =
        scopedFileQueryService.get(CallerContext.resolve(principal, userId), fileId);
    DownloadResolution resolution = downloadResolver.resolve(record);
    if (resolution.isRedirect()) {
      return ResponseEntity.status(302)
          .location(URI.create(resolution.redirect().url()))
          .cacheControl(resolution.cacheControl())
          .build();
    }

    HttpHeaders headers = new HttpHeaders();
    headers.setContentDisposition(
        ContentDisposition.inline().filename(record.getFilename(), StandardCharsets.UTF_8).build());
    try {
      headers.setContentType(MediaType.parseMediaType(record.getContentType()));
    } catch (InvalidMediaTypeException e) {
      headers.setContentType(MediaType.APPLICATION_OCTET_STREAM);
    }
    headers.setContentLength(record.getSize());
    return ResponseEntity.ok()
        .headers(headers)
        .cacheControl(resolution.cacheControl())
        .eTag(resolution.etag())
        .body(new InputStreamResource(resolution.content()));
  }

  @PatchMapping("/{fileId}")
  public ResponseEntity<FileResponse> updateAnnotation(
      @RequestHeader(name = "X-User-Id", required = false) String userId,
      Principal principal,
      @PathVariable String fileId,
      @Valid @RequestBody AnnotationUpdateRequest request) {
    FileRecord updated =
        fileLifecycleService.annotate(
            CallerContext.resolve(principal, userId), fileId, request.annotation());
    return ResponseEntity.ok(fileMapper.fromEntity(updated));
  }

  @DeleteMapping("/{fileId}")
  public ResponseEntity<Void> deleteFile(
      @RequestHeader(name = "X-User-Id", required = false) String userId,
      Principal principal,
      @PathVariable String fileId) {
    fileLifecycleService.delete(CallerContext.resolve(principal, userId), fileId);
    return ResponseEntity.noContent().build();
  }
}
