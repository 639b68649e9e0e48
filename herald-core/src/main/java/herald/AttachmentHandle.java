package herald;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reference to an attachment that travels with a {@link Notification}.
 *
 * <p>The core never opens it. Endpoints that {@linkplain
 * herald.endpoint.DeliveryEndpoint#supportsAttachments() support attachments} call
 * {@link #open()} while sending; others ignore it.
 */
public interface AttachmentHandle {

  /** File name presented to the recipient. */
  String name();

  /** MIME type, e.g. {@code image/png}. */
  String mimeType();

  /** Opens a fresh stream over the attachment bytes; the caller closes it. */
  InputStream open() throws IOException;
}
