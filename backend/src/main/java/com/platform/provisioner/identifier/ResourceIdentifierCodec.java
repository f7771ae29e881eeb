package com.platform.provisioner.identifier;

import com.platform.provisioner.error.MalformedIdentifierException;
import com.platform.provisioner.error.ValidationException;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Encodes and decodes composite resource identifiers.
 * <p>
 * An identifier is the ordered list of remote key parts joined by {@link #SEPARATOR},
 * e.g. {@code CLUSTER-ID:CLUSTER-ENDPOINT-ID}. Parts must not contain the separator;
 * this is the caller's responsibility and is not checked on encode.
 */
public final class ResourceIdentifierCodec {
    
    public static final String SEPARATOR = ":";
    
    private static final Pattern SPLITTER = Pattern.compile(Pattern.quote(SEPARATOR));
    
    private final List<String> partNames;
    
    private ResourceIdentifierCodec(List<String> partNames) {
        if (partNames.isEmpty()) {
            throw new IllegalArgumentException("an identifier needs at least one part");
        }
        this.partNames = List.copyOf(partNames);
    }
    
    /**
     * Creates a codec for identifiers made of the named parts, in order.
     */
    public static ResourceIdentifierCodec of(String... partNames) {
        return new ResourceIdentifierCodec(List.of(partNames));
    }
    
    public String encode(String... parts) {
        return encode(List.of(parts));
    }
    
    /**
     * Joins the parts with the separator.
     *
     * @throws ValidationException when the number of parts does not match the codec arity
     */
    public String encode(List<String> parts) {
        if (parts.size() != partNames.size()) {
            throw new ValidationException(String.format(
                "expected %d identifier parts (%s), got %d", partNames.size(), expectedLayout(), parts.size()));
        }
        return String.join(SEPARATOR, parts);
    }
    
    /**
     * Splits an identifier back into its parts.
     *
     * @throws MalformedIdentifierException when the part count differs from the arity or a part is empty
     */
    public List<String> decode(String id) {
        if (id == null) {
            throw new MalformedIdentifierException(null, expectedLayout());
        }
        
        String[] parts = SPLITTER.split(id, -1);
        if (parts.length != partNames.size()) {
            throw new MalformedIdentifierException(id, expectedLayout());
        }
        for (String part : parts) {
            if (part.isEmpty()) {
                throw new MalformedIdentifierException(id, expectedLayout());
            }
        }
        return List.of(parts);
    }
    
    public int arity() {
        return partNames.size();
    }
    
    public List<String> partNames() {
        return partNames;
    }
    
    /**
     * Human-readable layout used in error messages, e.g. {@code CLUSTER-ID:CLUSTER-ENDPOINT-ID}.
     */
    public String expectedLayout() {
        return String.join(SEPARATOR, partNames);
    }
}
