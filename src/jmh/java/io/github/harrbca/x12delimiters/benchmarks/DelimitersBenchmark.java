package io.github.harrbca.x12delimiters.benchmarks;

import io.github.harrbca.x12delimiters.x12.Delimiters;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.infra.Blackhole;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
public class DelimitersBenchmark {

    @State(Scope.Thread)
    public static class HeaderState {
        private byte[] standardIsa;
        private byte[] alternateIsa;
        private byte segmentTerminator;
        private byte elementSeparator;
        private byte subElementSeparator;
        private Delimiters defaults;
        private Delimiters valid;
        private Delimiters invalid;

        @Setup
        public void setup() {
            standardIsa = ("ISA*00*          *00*          *ZZ*SENDERID       *ZZ*RECEIVERID     "
                    + "*250403*0856*U*00501*000000001*0*P*:~").getBytes(StandardCharsets.US_ASCII);
            alternateIsa = ("ISA^00^          ^00^          ^ZZ^SENDERID       ^ZZ^RECEIVERID     "
                    + "^250403^0856^U^00401^000000002^1^T^>}").getBytes(StandardCharsets.US_ASCII);
            segmentTerminator = '~';
            elementSeparator = '*';
            subElementSeparator = ':';
            defaults = Delimiters.defaults();
            valid = new Delimiters((byte) '~', (byte) '*', (byte) ':');
            invalid = new Delimiters((byte) '~', (byte) '~', (byte) ':');
        }
    }

    @Benchmark
    public Delimiters defaults() {
        return Delimiters.defaults();
    }

    @Benchmark
    public Delimiters construct(HeaderState state) {
        return new Delimiters(state.segmentTerminator, state.elementSeparator, state.subElementSeparator);
    }

    @Benchmark
    public Delimiters fromIsaStandard(HeaderState state) {
        return Delimiters.fromIsa(state.standardIsa);
    }

    @Benchmark
    public Delimiters fromIsaAlternate(HeaderState state) {
        return Delimiters.fromIsa(state.alternateIsa);
    }

    @Benchmark
    public void getters(HeaderState state, Blackhole blackhole) {
        blackhole.consume(state.defaults.getSegmentTerminator());
        blackhole.consume(state.defaults.getElementSeparator());
        blackhole.consume(state.defaults.getSubElementSeparator());
    }

    @Benchmark
    public boolean areValidWhenValid(HeaderState state) {
        return state.valid.areValid();
    }

    @Benchmark
    public boolean areValidWhenInvalid(HeaderState state) {
        return state.invalid.areValid();
    }
}
