package com.perfwatch.analytics.predict;

@FunctionalInterface
public interface ModelTrainer {

    AutoregressiveModel train(CancellationToken token);
}
