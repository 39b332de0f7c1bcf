package io.github.harrbca.x12delimiters.benchmarks;

import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

public final class BenchmarkRunner {
    private BenchmarkRunner() {}

    public static void main(String[] args) throws RunnerException {
        Options options = new OptionsBuilder()
                .include(DelimitersBenchmark.class.getName())
                .shouldFailOnError(true)
                .forks(0)
                .build();
        new Runner(options).run();
    }
}
