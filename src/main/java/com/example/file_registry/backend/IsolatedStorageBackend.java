package com.example.file_registry.backend;

import com.example.file_registry.exception.BackendUnavailableException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Runs every I/O operation of one source on that source's own thread pool and bounds all but
 * deletes with a timeout, so a slow or hung backend only stalls callers of the same source.
 */
public class IsolatedStorageBackend implements StorageBackend, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(IsolatedStorageBackend.class);

  private final String sourceSlug;
  private final StorageBackend delegate;
  private final ExecutorService executor;
  private final Duration timeout;

  public IsolatedStorageBackend(
      String sourceSlug, StorageBackend delegate, int threads, Duration timeout) {
    this(
        sourceSlug,
        delegate,
        Executors.newFixedThreadPool(
            threads, new CustomizableThreadFactory("backend-" + sourceSlug + "-")),
        timeout);
  }

  IsolatedStorageBackend(
      String sourceSlug, StorageBackend delegate, ExecutorService executor, Duration timeout) {
    this.sourceSlug = sourceSlug;
    this.delegate = delegate;
    this.executor = executor;
    this.timeout = timeout;
  }

  public StorageBackend getDelegate() {
    return delegate;
  }

  @Override
  public String storageType() {
    return delegate.storageType();
  }

  @Override
  public void configure(Map<String, Object> settings, SecretResolver secrets) {
    delegate.configure(settings, secrets);
  }

  @Override
  public StorageCapabilities describeCapabilities() {
    return delegate.describeCapabilities();
  }

  @Override
  public Optional<BackendFileMetadata> statFile(String path) {
    return call("stat " + path, () -> delegate.statFile(path));
  }

  @Override
  public byte[] readFile(String path) {
    return call("read " + path, () -> delegate.readFile(path));
  }

  @Override
  public InputStream openStream(String path) {
    return call("open " + path, () -> delegate.openStream(path));
  }

  @Override
  public FilePage listFiles(String prefix, String cursor, int limit) {
    return call("list " + prefix, () -> delegate.listFiles(prefix, cursor, limit));
  }

  @Override
  public BackendFileMetadata storeFile(
      String path, InputStream content, long size, String contentType) {
    return call("store " + path, () -> delegate.storeFile(path, content, size, contentType));
  }

  /**
   * Waits for the delete to finish instead of timing it out. A delete already handed to the
   * backend cannot be taken back, so reporting a timeout would let the caller keep a row whose
   * bytes are about to disappear.
   */
  @Override
  public void deleteFile(String path) {
    Future<Void> future =
        submit(
            "delete " + path,
            () -> {
              delegate.deleteFile(path);
              return null;
            });
    try {
      future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackendUnavailableException(
          "Interrupted while waiting for source '" + sourceSlug + "' to delete " + path, e);
    } catch (ExecutionException e) {
      throw unwrap("delete " + path, e);
    }
  }

  @Override
  public SignedUrl signedDownloadUrl(String path, Duration ttl) {
    return call("sign " + path, () -> delegate.signedDownloadUrl(path, ttl));
  }

  @Override
  public UploadInstructions prepareDirectUpload(
      String path, String contentType, long size, String contentHash, Duration ttl) {
    return call(
        "prepare upload " + path,
        () -> delegate.prepareDirectUpload(path, contentType, size, contentHash, ttl));
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }

  private <T> T call(String operation, Callable<T> task) {
    Future<T> future = submit(operation, task);
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("Source '{}' timed out after {} during {}", sourceSlug, timeout, operation);
      throw new BackendUnavailableException(
          "Source '" + sourceSlug + "' timed out during " + operation, e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new BackendUnavailableException(
          "Interrupted while waiting for source '" + sourceSlug + "'", e);
    } catch (ExecutionException e) {
      throw unwrap(operation, e);
    }
  }

  private <T> Future<T> submit(String operation, Callable<T> task) {
    try {
      return executor.submit(task);
    } catch (RejectedExecutionException e) {
      throw new BackendUnavailableException(
          "Source '" + sourceSlug + "' is shut down, cannot " + operation, e);
    }
  }

  private RuntimeException unwrap(String operation, ExecutionException e) {
    Throwable cause = e.getCause();
    if (cause instanceof RuntimeException) {
      return (RuntimeException) cause;
    }
    if (cause instanceof Error) {
      throw (Error) cause;
    }
    return new BackendUnavailableException(
        "Source '" + sourceSlug + "' failed during " + operation, cause);
  }
}
