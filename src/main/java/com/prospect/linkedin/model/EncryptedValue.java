package com.prospect.linkedin.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Hex-encoded AES-GCM output. The tag is kept apart from the ciphertext so each part is stored in its own column.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EncryptedValue {
    private String ciphertext;
    private String iv;
    private String authTag;
}
