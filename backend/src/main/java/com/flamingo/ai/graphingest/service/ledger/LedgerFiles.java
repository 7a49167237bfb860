package com.flamingo.ai.graphingest.service.ledger;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.apache.commons.codec.digest.DigestUtils;

/** File naming shared by the ledger writer and reader. */
final class LedgerFiles {

  static final String SUFFIX = ".failed.json";

  private static final int ID_HASH_CHARS = 8;

  private LedgerFiles() {}

  static Path resolve(Path directory, String documentId) {
    return directory.resolve(fileStem(documentId) + SUFFIX);
  }

  /**
   * Ids that are already safe file names are used as they are. Others have unsafe characters
   * replaced and a short hash of the raw id appended, so {@code a/b} and {@code a_b} get
   * different ledgers.
   */
  private static String fileStem(String documentId) {
    String sanitized = documentId.replaceAll("[^A-Za-z0-9._-]", "_");
    if (sanitized.equals(documentId)) {
      return documentId;
    }
    String hash = DigestUtils.sha256Hex(documentId.getBytes(StandardCharsets.UTF_8));
    return sanitized + "-" + hash.substring(0, ID_HASH_CHARS);
  }
}
