package com.example.file_registry.util;

import com.example.file_registry.backend.UploadInstructions;
import com.example.file_registry.controller.dto.FileResponse;
import com.example.file_registry.controller.dto.SearchResponse;
import com.example.file_registry.controller.dto.SourceResponse;
import com.example.file_registry.controller.dto.UploadResponse;
import com.example.file_registry.controller.dto.UploadTargetResponse;
import com.example.file_registry.model.FileRecord;
import com.example.file_registry.model.FileSearchResult;
import com.example.file_registry.service.PendingUpload;
import com.example.file_registry.service.RegisteredSource;
import com.example.file_registry.service.UploadOutcome;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
public class FileMapper {
  static final String FILES_PATH = "/api/v1/files/";
  static final String SOURCES_PATH = "/api/v1/sources/";

  public FileResponse fromEntity(FileRecord fileRecord) {
    if (fileRecord == null) return null;
    return new FileResponse(
        fileRecord.getId(),
        fileRecord.getSourceSlug(),
        fileRecord.getPath(),
        fileRecord.getFilename(),
        fileRecord.getContentType(),
        fileRecord.getContentHash(),
        fileRecord.getSize(),
        fileRecord.getWidth(),
        fileRecord.getHeight(),
        fileRecord.getCreatedBy(),
        fileRecord.getCreatedAt(),
        fileRecord.getMetadata(),
        fileRecord.getAnnotation(),
        downloadLink(fileRecord.getId()));
  }

  public List<FileResponse> fromEntities(List<FileRecord> records) {
    return records.stream().map(this::fromEntity).collect(Collectors.toList());
  }

  public SearchResponse toResponse(FileSearchResult result) {
    return new SearchResponse(
        fromEntities(result.records()), result.nextCursor(), result.searchedSources());
  }

  public SourceResponse toResponse(RegisteredSource source) {
    return new SourceResponse(
        source.slug(), source.backendType(), source.label(), source.capabilities());
  }

  public UploadResponse toResponse(UploadOutcome outcome) {
    if (!outcome.isPending()) {
      return new UploadResponse(outcome.state().name(), fromEntity(outcome.file()), null);
    }
    PendingUpload pending = outcome.pending();
    UploadInstructions instructions = pending.instructions();
    UploadTargetResponse target =
        new UploadTargetResponse(
            pending.fileId(),
            pending.filename(),
            pending.contentType(),
            instructions.uploadUrl(),
            instructions.uploadMethod(),
            instructions.uploadHeaders(),
            instructions.uploadFields(),
            instructions.expiresAt(),
            SOURCES_PATH + pending.sourceSlug() + "/uploads/" + pending.fileId() + "/confirm");
    return new UploadResponse(outcome.state().name(), null, target);
  }

  public String downloadLink(String fileId) {
    return FILES_PATH + fileId + "/download";
  }
}
