package com.nl2sql.profiler.service.loading;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.springframework.stereotype.Component;

import com.nl2sql.profiler.config.ProfilerProperties;
import com.nl2sql.profiler.exception.DatasetLoadException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Decodes uploaded bytes by trying the configured charsets in order with strict decoding. A byte
 * order mark short-circuits the search. When every charset fails the bytes are decoded as UTF-8
 * with malformed sequences dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TextDecoder {

  private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

  private final ProfilerProperties properties;

  public String decode(byte[] bytes) {
    if (startsWith(bytes, UTF8_BOM)) {
      return decodeWithBom(
          Arrays.copyOfRange(bytes, UTF8_BOM.length, bytes.length), StandardCharsets.UTF_8);
    }
    if (bytes.length >= 2
        && ((bytes[0] == (byte) 0xFE && bytes[1] == (byte) 0xFF)
            || (bytes[0] == (byte) 0xFF && bytes[1] == (byte) 0xFE))) {
      // the UTF-16 decoder consumes the BOM itself
      return decodeWithBom(bytes, StandardCharsets.UTF_16);
    }

    for (String encoding : properties.getLoader().getEncodings()) {
      Charset charset;
      try {
        charset = Charset.forName(encoding);
      } catch (IllegalArgumentException e) {
        log.warn("Skipping unknown encoding '{}'", encoding);
        continue;
      }
      try {
        String text = decode(bytes, charset, CodingErrorAction.REPORT);
        log.debug("Decoded {} bytes as {}", bytes.length, charset.name());
        return stripBom(text);
      } catch (CharacterCodingException e) {
        log.debug("Input is not valid {}: {}", charset.name(), e.getMessage());
      }
    }

    log.warn("No configured encoding matched, decoding as UTF-8 and dropping malformed bytes");
    try {
      return stripBom(decode(bytes, StandardCharsets.UTF_8, CodingErrorAction.IGNORE));
    } catch (CharacterCodingException e) {
      throw new DatasetLoadException("Could not decode input with any supported encoding", e);
    }
  }

  private String decodeWithBom(byte[] bytes, Charset charset) {
    try {
      return stripBom(decode(bytes, charset, CodingErrorAction.REPORT));
    } catch (CharacterCodingException e) {
      throw new DatasetLoadException(
          "Input starts with a " + charset.name() + " byte order mark but is not valid", e);
    }
  }

  private static String decode(byte[] bytes, Charset charset, CodingErrorAction action)
      throws CharacterCodingException {
    return charset
        .newDecoder()
        .onMalformedInput(action)
        .onUnmappableCharacter(action)
        .decode(ByteBuffer.wrap(bytes))
        .toString();
  }

  private static String stripBom(String text) {
    return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
  }

  private static boolean startsWith(byte[] bytes, byte[] prefix) {
    if (bytes.length < prefix.length) {
      return false;
    }
    for (int i = 0; i < prefix.length; i++) {
      if (bytes[i] != prefix[i]) {
        return false;
      }
    }
    return true;
  }
}
