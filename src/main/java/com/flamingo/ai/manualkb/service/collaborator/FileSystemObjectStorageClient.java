package com.flamingo.ai.manualkb.service.collaborator;

import com.flamingo.ai.manualkb.config.ManualKbConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link ObjectStorageClient} backed by a local directory: {@code <basePath>/<bucket>/<key>}.
 *
 * <p>Used when no remote object store is configured.
 */
@Component
@Slf4j
public class FileSystemObjectStorageClient implements ObjectStorageClient {

  private final Path basePath;

  public FileSystemObjectStorageClient(ManualKbConfig config) {
    this.basePath = Path.of(config.getStorage().getBasePath());
  }

  @Override
  public boolean exists(String bucket, String key) {
    return Files.isRegularFile(resolve(bucket, key));
  }

  @Override
  public String upload(String bucket, String key, byte[] data, String contentType)
      throws IOException {
    Path target = resolve(bucket, key);
    Files.createDirectories(target.getParent());
    Files.write(target, data);
    log.debug("Stored {} ({} bytes, {})", target, data.length, contentType);
    return urlFor(bucket, key);
  }

  @Override
  public String urlFor(String bucket, String key) {
    return resolve(bucket, key).toUri().toString();
  }

  private Path resolve(String bucket, String key) {
    Path bucketDir = basePath.resolve(bucket).normalize();
    Path target = bucketDir.resolve(key).normalize();
    if (!target.startsWith(bucketDir)) {
      throw new IllegalArgumentException("Object key escapes bucket: " + key);
    }
    return target;
  }
}
