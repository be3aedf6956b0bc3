package io.github.drompincen.carebridge.runtime.transform;

import io.github.drompincen.carebridge.protocol.sync.ChangeRecord;
import io.github.drompincen.carebridge.protocol.sync.DocumentType;

public interface DocumentTransformer {

    DocumentType type();

    /**
     * @throws TransformException when the document fails validation
     */
    TransformedDocument transform(ChangeRecord change);
}
