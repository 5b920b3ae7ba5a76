package com.phonepe.contextspace.embedding;

import ai.djl.huggingface.translator.TextEmbeddingTranslatorFactory;
import ai.djl.inference.Predictor;
import ai.djl.repository.zoo.Criteria;
import ai.djl.repository.zoo.ZooModel;
import ai.djl.training.util.ProgressBar;
import com.google.common.base.Stopwatch;
import com.phonepe.contextspace.core.errors.ContextSpaceException;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.BasePooledObjectFactory;
import org.apache.commons.pool2.DestroyMode;
import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.impl.DefaultPooledObject;
import org.apache.commons.pool2.impl.GenericObjectPool;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Embeds text with a sentence transformer hosted on Hugging Face. The model is downloaded on first use.
 * Check <a href="https://docs.djl.ai/master/docs/load_model.html">DJL model loading</a> for supported urls.
 */
@Slf4j
public class HuggingfaceEmbeddingModel implements EmbeddingModel {
    public static final String DEFAULT_MODEL_URL
            = "djl://ai.djl.huggingface.pytorch/sentence-transformers/all-MiniLM-L6-v2";
    public static final int DEFAULT_DIMENSIONS = 384;
    private static final int DEFAULT_MAX_PREDICTORS = 8;

    private final ZooModel<String, float[]> zooModel;
    // Predictors are not thread safe, so every call borrows one
    private final GenericObjectPool<Predictor<String, float[]>> predictors;

    public HuggingfaceEmbeddingModel() {
        this(null, 0);
    }

    @Builder
    @SneakyThrows
    public HuggingfaceEmbeddingModel(String modelUrl, int maxPredictors) {
        final var url = Objects.requireNonNullElse(modelUrl, DEFAULT_MODEL_URL);
        System.setProperty("OPT_OUT_TRACKING", "true"); //DJL DIALS HOME ...

        final Criteria<String, float[]> criteria = Criteria.builder()
                .setTypes(String.class, float[].class)
                .optModelUrls(url)
                .optEngine("PyTorch")
                .optTranslatorFactory(new TextEmbeddingTranslatorFactory())
                .optProgress(new ProgressBar())
                .build();
        final var stopwatch = Stopwatch.createStarted();
        this.zooModel = criteria.loadModel();
        log.info("Loaded embedding model {} in {} ms", url, stopwatch.elapsed(TimeUnit.MILLISECONDS));

        final var config = new GenericObjectPoolConfig<Predictor<String, float[]>>();
        config.setMaxTotal(maxPredictors > 0 ? maxPredictors : DEFAULT_MAX_PREDICTORS);
        this.predictors = new GenericObjectPool<>(new PredictorFactory(zooModel), config);
    }

    @Override
    public float[] getEmbedding(String input) {
        Predictor<String, float[]> predictor = null;
        try {
            predictor = predictors.borrowObject();
            return predictor.predict(input);
        }
        catch (Exception e) {
            throw ContextSpaceException.embeddingFailure(e);
        }
        finally {
            if (predictor != null) {
                predictors.returnObject(predictor);
            }
        }
    }

    @Override
    public void close() {
        predictors.close();
        zooModel.close();
    }

    @RequiredArgsConstructor
    private static final class PredictorFactory extends BasePooledObjectFactory<Predictor<String, float[]>> {

        private final ZooModel<String, float[]> zooModel;

        @Override
        public Predictor<String, float[]> create() {
            log.debug("Creating new embedding predictor");
            return zooModel.newPredictor();
        }

        @Override
        public PooledObject<Predictor<String, float[]>> wrap(Predictor<String, float[]> predictor) {
            return new DefaultPooledObject<>(predictor);
        }

        @Override
        public void destroyObject(PooledObject<Predictor<String, float[]>> predictor, DestroyMode destroyMode) {
            log.debug("Closing embedding predictor");
            predictor.getObject().close();
        }
    }
}
