package dev.pekelund.medinterp.reportservice;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.SetOptions;
import com.google.cloud.firestore.WriteBatch;
import dev.pekelund.medinterp.model.PipelineResult;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores accepted interpretation results in Firestore, one document per report id.
 */
public class InterpretationResultRepository implements InterpretationResultSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(InterpretationResultRepository.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private final Firestore firestore;
    private final String collectionName;
    private final ObjectMapper objectMapper;

    public InterpretationResultRepository(Firestore firestore, String collectionName, ObjectMapper objectMapper) {
        this.firestore = Objects.requireNonNull(firestore, "firestore");
        this.collectionName = Objects.requireNonNull(collectionName, "collectionName");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        LOGGER.info("InterpretationResultRepository initialized with collection '{}'", collectionName);
    }

    @Override
    public void save(PipelineResult result) {
        Objects.requireNonNull(result, "result");
        if (!result.isAccepted()) {
            throw new IllegalArgumentException("Only accepted results are stored; report " + result.reportId()
                + " was " + result.status().value());
        }
        String documentId = result.reportId();
        Map<String, Object> payload = toPayload(result);
        try {
            DocumentReference documentReference = firestore.collection(collectionName).document(documentId);
            LOGGER.info("Writing payload with {} entries to Firestore document {}/{}", payload.size(), collectionName,
                documentId);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Firestore payload for {}/{}: {}", collectionName, documentId, payload);
            }

            WriteBatch batch = firestore.batch();
            batch.set(documentReference, payload, SetOptions.merge());
            batch.commit().get();
            LOGGER.info("Firestore document {}/{} successfully written", collectionName, documentId);
        } catch (InterruptedException ex) {
            LOGGER.error("Interrupted while writing Firestore document {}/{}", collectionName, documentId, ex);
            Thread.currentThread().interrupt();
            throw new InterpretationPersistenceException("Interrupted while storing report " + documentId, ex);
        } catch (ExecutionException ex) {
            LOGGER.error("ExecutionException while writing Firestore document {}/{}", collectionName, documentId, ex);
            throw new InterpretationPersistenceException("Failed to store report " + documentId + " in Firestore", ex);
        }
    }

    Map<String, Object> toPayload(PipelineResult result) {
        Map<String, Object> payload = new LinkedHashMap<>(objectMapper.convertValue(result, MAP_TYPE));
        payload.put("pseudoId", result.patient() != null ? result.patient().pseudoId() : null);
        payload.put("category", result.interpretation() != null && result.interpretation().category() != null
            ? result.interpretation().category().label() : null);
        payload.put("storedAt", Timestamp.now());
        return payload;
    }
}
