package dfrs;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import com.google.common.io.BaseEncoding;
import com.google.common.io.ByteStreams;

/** The transport encoding of code lines: gzip, then standard base64. */
public final class CodeTemplates {

  private CodeTemplates() {}

  public static String compress(String json) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (GZIPOutputStream gzip = new GZIPOutputStream(bytes)) {
      gzip.write(json.getBytes(UTF_8));
    } catch (IOException ex) {
      // In-memory streams do not fail.
      throw new AssertionError(ex);
    }
    return BaseEncoding.base64().encode(bytes.toByteArray());
  }

  /**
   * Inverts {@link #compress}.
   *
   * @throws IllegalArgumentException if the code is not base64 encoded gzip data
   */
  public static String decompress(String code) {
    byte[] compressed = BaseEncoding.base64().decode(code.trim());
    try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
      return new String(ByteStreams.toByteArray(in), UTF_8);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid code template", ex);
    }
  }

  /** Whether the text looks like a raw JSON code line rather than a compressed template. */
  public static boolean isJson(String text) {
    return text.trim().startsWith("{");
  }
}
