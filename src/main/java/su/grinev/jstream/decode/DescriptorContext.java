package su.grinev.jstream.decode;

import java.util.Collection;

/**
 * A group of descriptors registered together, usually one per application module.
 */
public interface DescriptorContext {

    Collection<ValueDescriptor<?>> descriptors();
}
