package com.scholary.dubbing.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.dubbing.error.NotFoundException;
import com.scholary.dubbing.objectstore.ObjectStoreClient;
import com.scholary.dubbing.objectstore.ObjectStoreClient.ObjectMetadata;
import com.scholary.dubbing.objectstore.ObjectStoreException;
import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ObjectStoreVideoSourceTest {

  @Mock private ObjectStoreClient client;

  @TempDir Path tempDir;

  @Test
  void fetch_shouldStreamObjectToTargetDirectory() throws Exception {
    when(client.getObjectMetadata("videos", "talks/intro.mp4"))
        .thenReturn(new ObjectMetadata(3, "video/mp4"));
    when(client.getObjectStream("videos", "talks/intro.mp4"))
        .thenReturn(new ByteArrayInputStream(new byte[] {4, 5, 6}));
    ObjectStoreVideoSource source = new ObjectStoreVideoSource(client);

    Path fetched = source.fetch("s3://videos/talks/intro.mp4", tempDir);

    assertThat(fetched).isEqualTo(tempDir.resolve("intro.mp4"));
    assertThat(Files.readAllBytes(fetched)).containsExactly(4, 5, 6);
  }

  @Test
  void fetch_shouldMapMissingObjectToNotFound() {
    when(client.getObjectMetadata("videos", "gone.mp4"))
        .thenThrow(
            new ObjectStoreException(
                "Object not found: bucket=videos, key=gone.mp4", new RuntimeException(), true));
    ObjectStoreVideoSource source = new ObjectStoreVideoSource(client);

    assertThatThrownBy(() -> source.fetch("s3://videos/gone.mp4", tempDir))
        .isInstanceOf(NotFoundException.class)
        .hasMessage("Video not found: s3://videos/gone.mp4");
  }

  @Test
  void fetch_shouldPropagateOtherStorageFailures() {
    ObjectStoreException failure = new ObjectStoreException("statusCode=503", new RuntimeException());
    when(client.getObjectMetadata("videos", "talk.mp4")).thenThrow(failure);
    ObjectStoreVideoSource source = new ObjectStoreVideoSource(client);

    assertThatThrownBy(() -> source.fetch("s3://videos/talk.mp4", tempDir)).isSameAs(failure);
  }

  @Test
  void fetch_shouldRejectReferenceWithoutKey() {
    ObjectStoreVideoSource source = new ObjectStoreVideoSource(client);

    assertThatThrownBy(() -> source.fetch("s3://videos/", tempDir))
        .isInstanceOf(NotFoundException.class);
    assertThatThrownBy(() -> source.fetch("s3://videos", tempDir))
        .isInstanceOf(NotFoundException.class);
    verifyNoInteractions(client);
  }
}
