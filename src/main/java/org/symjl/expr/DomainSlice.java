package org.symjl.expr;

import java.util.List;
import java.util.Objects;

/**
 * Placement of one child subdomain inside a {@link DomainConcatenation}.
 * 
 * Both lists hold one slice per secondary-dimension repetition.
 * 
 * @param domain       The subdomain name
 * @param childSlices  Slices into the child's own value
 * @param targetSlices Slices into the concatenated result
 */
public record DomainSlice(String domain, List<Slice> childSlices, List<Slice> targetSlices) {

    public DomainSlice {
        Objects.requireNonNull(domain, "Domain cannot be null");
        childSlices = List.copyOf(childSlices);
        targetSlices = List.copyOf(targetSlices);
        if (childSlices.size() != targetSlices.size()) {
            throw new IllegalArgumentException("Domain '" + domain
                    + "' has " + childSlices.size() + " child slices but " + targetSlices.size() + " target slices");
        }
        for (int i = 0; i < childSlices.size(); i++) {
            if (childSlices.get(i).length() != targetSlices.get(i).length()) {
                throw new IllegalArgumentException("Domain '" + domain + "' slice " + i + " changes length");
            }
        }
    }

    public int repetitions() {
        return childSlices.size();
    }
}
