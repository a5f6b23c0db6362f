package at.sv.astro;

@FunctionalInterface
public interface Computation<T> {

    T compute(CancellationToken token);
}
