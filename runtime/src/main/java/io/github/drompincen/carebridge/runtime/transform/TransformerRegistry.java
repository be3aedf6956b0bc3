package io.github.drompincen.carebridge.runtime.transform;

import io.github.drompincen.carebridge.protocol.sync.ChangeRecord;
import io.github.drompincen.carebridge.protocol.sync.DocumentType;
import io.github.drompincen.carebridge.runtime.transform.TransformException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Routes a change to the transformer registered for its type discriminator.
 */
@Component
public class TransformerRegistry {

    private static final Logger log = LoggerFactory.getLogger(TransformerRegistry.class);

    private final Map<DocumentType, DocumentTransformer> transformers = new EnumMap<>(DocumentType.class);

    public TransformerRegistry(List<DocumentTransformer> transformers) {
        for (DocumentTransformer transformer : transformers) {
            DocumentTransformer previous = this.transformers.put(transformer.type(), transformer);
            if (previous != null) {
                throw new IllegalStateException("Two transformers registered for " + transformer.type()
                        + ": " + previous.getClass().getSimpleName() + ", " + transformer.getClass().getSimpleName());
            }
        }
        log.info("Registered document transformers for {}", this.transformers.keySet());
    }

    public TransformedDocument transform(ChangeRecord change) {
        String discriminator = change.type();
        if (discriminator == null) {
            throw new TransformException(Reason.MISSING_TYPE, change.id(),
                    "Document " + change.id() + " has no type field");
        }
        DocumentTransformer transformer = DocumentType.fromDiscriminator(discriminator)
                .map(transformers::get)
                .orElseThrow(() -> new TransformException(Reason.UNKNOWN_TYPE, change.id(),
                        "Document " + change.id() + " has unknown type " + discriminator));
        return transformer.transform(change);
    }

    public Set<DocumentType> registeredTypes() {
        return transformers.keySet();
    }
}
