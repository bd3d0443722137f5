package com.example.file_registry.controller;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.example.file_registry.backend.StorageCapabilities;
import com.example.file_registry.backend.UploadInstructions;
import com.example.file_registry.controller.dto.FileUploadRequest;
import com.example.file_registry.exception.ConfigurationException;
import com.example.file_registry.exception.DuplicatePathException;
import com.example.file_registry.exception.PayloadTooLargeException;
import com.example.file_registry.exception.SourceNotFoundException;
import com.example.file_registry.model.FileRecord;
import com.example.file_registry.security.CallerContext;
import com.example.file_registry.service.PendingUpload;
import com.example.file_registry.service.RegisteredSource;
import com.example.file_registry.service.ScopedFileQueryService;
import com.example.file_registry.service.SourceProvisioningService;
import com.example.file_registry.service.SourceRegistry;
import com.example.file_registry.service.SourceSyncService;
import com.example.file_registry.service.UploadConfirmation;
import com.example.file_registry.service.UploadOrchestrator;
import com.example.file_registry.service.UploadOutcome;
import com.example.file_registry.service.UploadRequest;
import com.example.file_registry.util.FileIds;
import com.example.file_registry.util.FileMapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

@WebMvcTest(SourceController.class)
@Import({ValidationAutoConfiguration.class, FileMapper.class})
public class SourceControllerTest {

  private MockMvc mockMvc;

  @MockBean private SourceRegistry sourceRegistry;

  @MockBean private SourceProvisioningService sourceProvisioningService;

  @MockBean private ScopedFileQueryService scopedFileQueryService;

  @MockBean private UploadOrchestrator uploadOrchestrator;

  @MockBean private SourceSyncService sourceSyncService;

  @Autowired private ObjectMapper objectMapper;

  @Autowired private WebApplicationContext webApplicationContext;

  private final CallerContext alice = CallerContext.of("alice");
  private RegisteredSource docs;

  @BeforeEach
  void setUp() {
    this.mockMvc = MockMvcBuilders.webAppContextSetup(this.webApplicationContext).build();
    this.docs =
        new RegisteredSource(
            "docs",
            "filesystem",
            "Documents",
            null,
            StorageCapabilities.builder()
                .canUpload(true)
                .canDelete(true)
                .canList(true)
                .requiresProxyDownload(true)
                .build());
  }

  private static FileRecord uploaded(String id) {
    return FileRecord.builder()
        .id(id)
        .sourceSlug("docs")
        .path(FileIds.ulidPart(id) + "/report.txt")
        .filename("report.txt")
        .contentType("text/plain")
        .contentHash("sha256:feed")
        .size(12)
        .createdBy("alice")
        .createdAt(Instant.now())
        .metadata(Map.of())
        .build();
  }

  @Test
  void listSources_shouldReturnVisibleSourcesAndFailures() throws Exception {
    when(scopedFileQueryService.visibleSources(alice)).thenReturn(List.of(docs));
    when(sourceRegistry.failures()).thenReturn(Map.of("legacy", "Unknown storage type 'ftp'"));

    mockMvc
        .perform(get("/api/v1/sources").header("X-User-Id", "alice"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.sources[0].slug").value("docs"))
        .andExpect(jsonPath("$.sources[0].storage").value("filesystem"))
        .andExpect(jsonPath("$.sources[0].capabilities.requiresProxyDownload").value(true))
        .andExpect(jsonPath("$.unavailable.legacy").value("Unknown storage type 'ftp'"));
  }

  @Test
  void registerSource_whenValid_shouldReturn201() throws Exception {
    when(sourceProvisioningService.registerRuntimeSource(
            eq("docs"), eq("filesystem"), eq("Documents"), any()))
        .thenReturn(docs);

    mockMvc
        .perform(
            post("/api/v1/sources")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"slug\":\"docs\",\"storage\":\"filesystem\",\"label\":\"Documents\","
                        + "\"config\":{\"root\":\"/srv/docs\"}}"))
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", "/api/v1/sources/docs"))
        .andExpect(jsonPath("$.label").value("Documents"));
  }

  @Test
  void registerSource_whenSlugInvalid_shouldReturn400() throws Exception {
    mockMvc
        .perform(
            post("/api/v1/sources")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"slug\":\"Not Valid\",\"storage\":\"filesystem\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Validation failed"));

    verifyNoInteractions(sourceProvisioningService);
  }

  @Test
  void registerSource_whenSlugTaken_shouldReturn400() throws Exception {
    when(sourceProvisioningService.registerRuntimeSource(any(), any(), any(), any()))
        .thenThrow(new ConfigurationException("Source 'docs' already exists"));

    mockMvc
        .perform(
            post("/api/v1/sources")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"slug\":\"docs\",\"storage\":\"filesystem\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Source 'docs' already exists"));
  }

  @Test
  void uploadFile_whenHostIngested_shouldReturn201WithRecord() throws Exception {
    String fileId = FileIds.newId();
    MockMultipartFile filePart =
        new MockMultipartFile(
            "file", "original.txt", MediaType.TEXT_PLAIN_VALUE, "Test content".getBytes());
    MockMultipartFile propertiesPart =
        new MockMultipartFile(
            "properties",
            null,
            MediaType.APPLICATION_JSON_VALUE,
            objectMapper.writeValueAsBytes(
                new FileUploadRequest("report.txt", Map.of("ticket", "T-1"))));
    when(scopedFileQueryService.requireSource(alice, "docs")).thenReturn(docs);
    when(uploadOrchestrator.beginUpload(any(UploadRequest.class)))
        .thenReturn(UploadOutcome.confirmed(uploaded(fileId)));

    mockMvc
        .perform(
            multipart("/api/v1/sources/{slug}/uploads", "docs")
                .file(filePart)
                .file(propertiesPart)
                .header("X-User-Id", "alice")
                .accept(MediaType.APPLICATION_JSON))
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", "/api/v1/files/" + fileId + "/download"))
        .andExpect(jsonPath("$.state").value("CONFIRMED"))
        .andExpect(jsonPath("$.file.id").value(fileId))
        .andExpect(jsonPath("$.file.contentHash").value("sha256:feed"));

    ArgumentCaptor<UploadRequest> captor = ArgumentCaptor.forClass(UploadRequest.class);
    verify(uploadOrchestrator).beginUpload(captor.capture());
    UploadRequest request = captor.getValue();
    assertEquals("docs", request.sourceSlug());
    assertEquals("report.txt", request.filename());
    assertEquals(12L, request.size());
    assertEquals("alice", request.createdBy());
    assertEquals("T-1", request.metadata().get("ticket"));
    assertNotNull(request.content());
  }

  @Test
  void uploadFile_withoutProperties_shouldUseOriginalFilename() throws Exception {
    MockMultipartFile filePart =
        new MockMultipartFile("file", "original.txt", MediaType.TEXT_PLAIN_VALUE, "x".getBytes());
    when(uploadOrchestrator.beginUpload(any(UploadRequest.class)))
        .thenReturn(UploadOutcome.confirmed(uploaded(FileIds.newId())));

    mockMvc
        .perform(multipart("/api/v1/sources/{slug}/uploads", "docs").file(filePart))
        .andExpect(status().isCreated());

    ArgumentCaptor<UploadRequest> captor = ArgumentCaptor.forClass(UploadRequest.class);
    verify(uploadOrchestrator).beginUpload(captor.capture());
    assertEquals("original.txt", captor.getValue().filename());
    assertNull(captor.getValue().createdBy());
  }

  @Test
  void uploadFile_whenSourceHidden_shouldReturn404WithoutStoring() throws Exception {
    MockMultipartFile filePart =
        new MockMultipartFile("file", "a.txt", MediaType.TEXT_PLAIN_VALUE, "x".getBytes());
    when(scopedFileQueryService.requireSource(any(CallerContext.class), eq("secret")))
        .thenThrow(new SourceNotFoundException("Source not found: secret"));

    mockMvc
        .perform(multipart("/api/v1/sources/{slug}/uploads", "secret").file(filePart))
        .andExpect(status().isNotFound());

    verifyNoInteractions(uploadOrchestrator);
  }

  @Test
  void uploadFile_whenTooLarge_shouldReturn413() throws Exception {
    MockMultipartFile filePart =
        new MockMultipartFile("file", "big.bin", "application/octet-stream", new byte[64]);
    when(uploadOrchestrator.beginUpload(any(UploadRequest.class)))
        .thenThrow(new PayloadTooLargeException(64, 10));

    mockMvc
        .perform(multipart("/api/v1/sources/{slug}/uploads", "docs").file(filePart))
        .andExpect(status().isPayloadTooLarge());
  }

  @Test
  void uploadFile_whenPathTaken_shouldReturn409() throws Exception {
    MockMultipartFile filePart =
        new MockMultipartFile("file", "a.txt", MediaType.TEXT_PLAIN_VALUE, "x".getBytes());
    when(uploadOrchestrator.beginUpload(any(UploadRequest.class)))
        .thenThrow(new DuplicatePathException("Path already registered"));

    mockMvc
        .perform(multipart("/api/v1/sources/{slug}/uploads", "docs").file(filePart))
        .andExpect(status().isConflict());
  }

  @Test
  void prepareUpload_whenDirectUploadSource_shouldReturn202WithTarget() throws Exception {
    String fileId = FileIds.newId();
    String path = FileIds.ulidPart(fileId) + "/photo.png";
    Instant expiresAt = Instant.parse("2030-01-01T00:00:00Z");
    PendingUpload pending =
        new PendingUpload(
            fileId,
            "media",
            path,
            "photo.png",
            "image/png",
            new UploadInstructions(
                "https://upload.test/" + path,
                "PUT",
                Map.of("Content-Type", "image/png"),
                Map.of(),
                expiresAt));
    when(uploadOrchestrator.beginUpload(any(UploadRequest.class)))
        .thenReturn(UploadOutcome.pending(pending));

    mockMvc
        .perform(
            post("/api/v1/sources/{slug}/uploads/prepare", "media")
                .header("X-User-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"filename\":\"photo.png\",\"contentType\":\"image/png\",\"size\":2048}"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.state").value("PENDING"))
        .andExpect(jsonPath("$.upload.fileId").value(fileId))
        .andExpect(jsonPath("$.upload.uploadMethod").value("PUT"))
        .andExpect(jsonPath("$.upload.uploadHeaders['Content-Type']").value("image/png"))
        .andExpect(
            jsonPath("$.upload.confirmLink")
                .value("/api/v1/sources/media/uploads/" + fileId + "/confirm"));

    ArgumentCaptor<UploadRequest> captor = ArgumentCaptor.forClass(UploadRequest.class);
    verify(uploadOrchestrator).beginUpload(captor.capture());
    assertNull(captor.getValue().content());
    assertEquals(2048L, captor.getValue().size());
  }

  @Test
  void prepareUpload_whenSizeNegative_shouldReturn400() throws Exception {
    mockMvc
        .perform(
            post("/api/v1/sources/{slug}/uploads/prepare", "media")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"filename\":\"photo.png\",\"size\":-1}"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(uploadOrchestrator);
  }

  @Test
  void prepareUpload_withContentHash_shouldPassItToOrchestrator() throws Exception {
    String hash = "sha256:" + "ab".repeat(32);
    when(uploadOrchestrator.beginUpload(any(UploadRequest.class)))
        .thenReturn(UploadOutcome.confirmed(uploaded(FileIds.newId())));

    mockMvc
        .perform(
            post("/api/v1/sources/{slug}/uploads/prepare", "media")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"filename\":\"photo.png\",\"size\":9,\"contentHash\":\""
                        + hash
                        + "\"}"))
        .andExpect(status().isCreated());

    ArgumentCaptor<UploadRequest> captor = ArgumentCaptor.forClass(UploadRequest.class);
    verify(uploadOrchestrator).beginUpload(captor.capture());
    assertEquals(hash, captor.getValue().contentHash());
  }

  @Test
  void prepareUpload_whenContentHashMalformed_shouldReturn400() throws Exception {
    mockMvc
        .perform(
            post("/api/v1/sources/{slug}/uploads/prepare", "media")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"filename\":\"photo.png\",\"size\":9,\"contentHash\":\"md5:1\"}"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(uploadOrchestrator);
  }

  @Test
  void confirmUpload_shouldReturn201WithRecord() throws Exception {
    String fileId = FileIds.newId();
    when(uploadOrchestrator.confirmUpload(any(UploadConfirmation.class)))
        .thenReturn(uploaded(fileId));

    mockMvc
        .perform(
            post("/api/v1/sources/{slug}/uploads/{id}/confirm", "media", fileId)
                .header("X-User-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"filename\":\"report.txt\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value(fileId));

    verify(uploadOrchestrator)
        .confirmUpload(new UploadConfirmation("media", fileId, "report.txt", "alice", null));
  }

  @Test
  void sync_shouldReturnReport() throws Exception {
    when(sourceSyncService.sync("docs"))
        .thenReturn(new SourceSyncService.SyncReport("docs", 3, 2, 1));

    mockMvc
        .perform(post("/api/v1/sources/{slug}/sync", "docs").header("X-User-Id", "alice"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.added").value(2))
        .andExpect(jsonPath("$.skipped").value(1));

    verify(scopedFileQueryService).requireSource(alice, "docs");
  }

  @Test
  void reconcile_whenSourceHidden_shouldReturn404() throws Exception {
    when(scopedFileQueryService.requireSource(any(CallerContext.class), eq("docs")))
        .thenThrow(new SourceNotFoundException("Source not found: docs"));

    mockMvc
        .perform(post("/api/v1/sources/{slug}/reconcile", "docs"))
        .andExpect(status().isNotFound());

    verifyNoInteractions(sourceSyncService);
  }
}
