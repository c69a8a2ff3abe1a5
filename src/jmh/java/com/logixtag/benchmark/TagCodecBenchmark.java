package com.logixtag.benchmark;

import com.logixtag.catalog.FieldDescriptor;
import com.logixtag.catalog.TypeCatalog;
import com.logixtag.core.BinaryImage;
import com.logixtag.core.TagCodec;
import com.logixtag.core.TagUpdates;
import com.logixtag.layout.Layout;
import com.logixtag.layout.LayoutAssigner;
import com.logixtag.literal.DefaultValueSynthesizer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for layout assignment, decode and encode of a mid-sized structured tag.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 10, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class TagCodecBenchmark {

    private TypeCatalog catalog;
    private List<FieldDescriptor> parameters;
    private Layout layout;
    private BinaryImage image;
    private TagCodec codec;

    private TagUpdates singleUpdate;
    private TagUpdates boolUpdate;
    private TagUpdates textUpdates;
    private List<String> selectedPaths;

    @Setup
    public void setup() throws Exception {
        catalog = TypeCatalog.builder()
                .composite("Gains", FieldDescriptor.of("Kp", "REAL"), FieldDescriptor.of("Ki", "REAL"),
                        FieldDescriptor.of("Kd", "REAL"))
                .composite("Loop", FieldDescriptor.of("Enabled", "BOOL"), FieldDescriptor.of("Mode", "SINT"),
                        FieldDescriptor.of("Setpoint", "DINT"), FieldDescriptor.of("Tuning", "Gains"))
                .build();

        parameters = new ArrayList<>();
        parameters.add(FieldDescriptor.of("EnableIn", "BOOL"));
        parameters.add(FieldDescriptor.of("EnableOut", "BOOL"));
        for (int i = 0; i < 40; i++) {
            parameters.add(FieldDescriptor.of("Flag" + i, "BOOL"));
        }
        parameters.add(FieldDescriptor.array("Counts", "DINT", 16));
        parameters.add(FieldDescriptor.of("Total", "LINT"));
        parameters.add(FieldDescriptor.array("Loops", "Loop", 8));

        layout = new LayoutAssigner(catalog).assign(parameters);
        image = BinaryImage.allocate(layout.getTotalByteSize());
        codec = new TagCodec();

        singleUpdate = TagUpdates.builder().set("Loops[7].Tuning.Kd", 1.25f).build();
        boolUpdate = TagUpdates.builder().set("Flag33", true).build();
        textUpdates = TagUpdates.builder()
                .setText("EnableIn", "1")
                .setText("Counts[3]", "-42")
                .setText("Total", "9000000000")
                .setText("Loops[2].Setpoint", "150")
                .setText("Loops[2].Tuning.Kp", "2.5e+000")
                .build();
        selectedPaths = List.of("EnableIn", "Counts[3]", "Loops[2].Setpoint", "Loops[7].Tuning.Kd");
    }

    // ===== LAYOUT =====

    @Benchmark
    public void assignLayout(Blackhole bh) throws Exception {
        bh.consume(new LayoutAssigner(catalog).assign(parameters));
    }

    @Benchmark
    public void synthesizeDefault(Blackhole bh) throws Exception {
        bh.consume(new DefaultValueSynthesizer(catalog).synthesizeDefault("Loop"));
    }

    // ===== DECODE =====

    @Benchmark
    public void decodeAll(Blackhole bh) throws Exception {
        bh.consume(codec.decode(layout, image));
    }

    @Benchmark
    public void decodeSelected(Blackhole bh) throws Exception {
        bh.consume(codec.decode(layout, image, selectedPaths));
    }

    @Benchmark
    public void decodeSingleField(Blackhole bh) throws Exception {
        bh.consume(codec.decodeField(layout, image, "Loops[5].Tuning.Ki"));
    }

    // ===== ENCODE =====

    @Benchmark
    public void encodeSingleField(Blackhole bh) throws Exception {
        bh.consume(codec.encode(layout, image, singleUpdate));
    }

    @Benchmark
    public void encodeSingleBool(Blackhole bh) throws Exception {
        bh.consume(codec.encode(layout, image, boolUpdate));
    }

    @Benchmark
    public void encodeTextUpdates(Blackhole bh) throws Exception {
        bh.consume(codec.encode(layout, image, textUpdates));
    }

    @Benchmark
    public void encodeEachTextUpdates(Blackhole bh) {
        bh.consume(codec.encodeEach(layout, image, textUpdates));
    }
}
