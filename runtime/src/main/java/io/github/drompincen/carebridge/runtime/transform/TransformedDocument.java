package io.github.drompincen.carebridge.runtime.transform;

import io.github.drompincen.carebridge.protocol.sync.DocumentType;

public interface TransformedDocument {
    DocumentType type();
    DocumentHeader header();
}
