package org.symjl.expr;

import java.util.List;

/**
 * Concatenation whose result follows the spatial ordering of subdomains
 * rather than the declaration order of its children.
 * 
 * Each child owns one or more subdomains. For every secondary-dimension
 * repetition, each subdomain contributes the slice {@code childSlices[i]} of
 * the child's value at position {@code targetSlices[i]} of the result.
 * 
 * @param id                The node identity
 * @param children          The concatenated children
 * @param childDomains      Per child, the subdomains it covers
 * @param secondaryPoints   Number of secondary-dimension repetitions
 */
public record DomainConcatenation(
        int id,
        List<ExpressionNode> children,
        List<List<DomainSlice>> childDomains,
        int secondaryPoints) implements ExpressionNode {

    public DomainConcatenation {
        children = List.copyOf(children);
        childDomains = childDomains.stream().map(List::copyOf).toList();
        if (children.isEmpty()) {
            throw new IllegalArgumentException("Domain concatenation requires at least one child");
        }
        if (childDomains.size() != children.size()) {
            throw new IllegalArgumentException("Expected domain slices for " + children.size()
                    + " children but got " + childDomains.size());
        }
        if (secondaryPoints < 1) {
            throw new IllegalArgumentException("Secondary points must be positive: " + secondaryPoints);
        }
        for (List<DomainSlice> domains : childDomains) {
            for (DomainSlice domain : domains) {
                if (domain.repetitions() != secondaryPoints) {
                    throw new IllegalArgumentException("Domain '" + domain.domain() + "' has "
                            + domain.repetitions() + " slices, expected " + secondaryPoints);
                }
            }
        }
    }

    @Override
    public Shape shape() {
        int total = 0;
        for (List<DomainSlice> domains : childDomains) {
            for (DomainSlice domain : domains) {
                total += domain.targetSlices().stream().mapToInt(Slice::length).sum();
            }
        }
        return Shape.vector(total);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DOMAIN_CONCATENATION;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitDomainConcatenation(this);
    }

    @Override
    public String toString() {
        return "domain_concat" + children;
    }
}
