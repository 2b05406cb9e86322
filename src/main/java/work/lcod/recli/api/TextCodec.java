package work.lcod.recli.api;

/**
 * Symbolic text form of a value type. Types with a codec are handled as opaque scalars:
 * they are printed and parsed through the codec rather than through their raw representation.
 */
public interface TextCodec<T> {
    String marshal(T value);

    T unmarshal(String text) throws Exception;
}
