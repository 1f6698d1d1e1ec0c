package de.mattis.arraybench.bench;

import de.mattis.arraybench.array.InitializableArray;
import de.mattis.arraybench.array.LongArray;

import java.util.ArrayList;
import java.util.List;

/**
 * Test-Double: delegiert an {@link LongArray} und protokolliert jede Operation.
 */
class RecordingArray implements InitializableArray {

    enum Kind { INIT, READ, WRITE }

    record Op(Kind kind, long index, long value) {}

    private final LongArray delegate;
    final List<Op> ops = new ArrayList<>();

    RecordingArray(long n) {
        this.delegate = new LongArray(n);
    }

    @Override
    public long init(long value) {
        ops.add(new Op(Kind.INIT, -1, value));
        return delegate.init(value);
    }

    @Override
    public long read(long index) {
        long v = delegate.read(index);
        ops.add(new Op(Kind.READ, index, v));
        return v;
    }

    @Override
    public void write(long index, long value) {
        ops.add(new Op(Kind.WRITE, index, value));
        delegate.write(index, value);
    }

    @Override
    public long size() {
        return delegate.size();
    }

    @Override
    public String name() {
        return "recording";
    }

    long count(Kind kind) {
        return ops.stream().filter(o -> o.kind() == kind).count();
    }
}
