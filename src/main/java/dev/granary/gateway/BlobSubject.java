package dev.granary.gateway;

import java.util.Optional;

/**
 * Location of a blob parsed from an event subject of the form {@code
 * /blobServices/default/containers/{container}/blobs/{blob_path}}.
 *
 * @param container container (bucket) name
 * @param blobPath path inside the container, may contain slashes
 */
public record BlobSubject(String container, String blobPath) {

  private static final String CONTAINERS = "/containers/";
  private static final String BLOBS = "/blobs/";

  /**
   * Parse a subject.
   *
   * @return empty if either delimiter is missing or a part is empty
   */
  public static Optional<BlobSubject> parse(String subject) {
    if (subject == null) {
      return Optional.empty();
    }
    int containersAt = subject.indexOf(CONTAINERS);
    if (containersAt < 0) {
      return Optional.empty();
    }
    String rest = subject.substring(containersAt + CONTAINERS.length());
    int blobsAt = rest.indexOf(BLOBS);
    if (blobsAt <= 0) {
      return Optional.empty();
    }
    String container = rest.substring(0, blobsAt);
    String blobPath = rest.substring(blobsAt + BLOBS.length());
    if (blobPath.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new BlobSubject(container, blobPath));
  }
}
