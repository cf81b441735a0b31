package com.entity.ancestry;

import com.entity.ancestry.core.model.EntityDescriptor;
import com.entity.ancestry.relation.EdgeSetSubtypeRelation;

import java.util.List;

/**
 * Test fixture with two hierarchies.
 *
 * <pre>
 *                                     F
 *                                    / \
 *      A                            H   \
 *     / \                          / \   \
 *    B   C                        I   J   G
 *   /   / \                        \ /   / \
 *  T   D   E                        K   L   Z
 *                                   |
 *                                   W
 * </pre>
 */
public final class SampleHierarchy {

    public static final EntityDescriptor A = EntityDescriptor.of("A");
    public static final EntityDescriptor B = EntityDescriptor.of("B");
    public static final EntityDescriptor C = EntityDescriptor.of("C");
    public static final EntityDescriptor D = EntityDescriptor.of("D");
    public static final EntityDescriptor E = EntityDescriptor.of("E");
    public static final EntityDescriptor T = EntityDescriptor.of("T");
    public static final EntityDescriptor F = EntityDescriptor.of("F");
    public static final EntityDescriptor G = EntityDescriptor.of("G");
    public static final EntityDescriptor H = EntityDescriptor.of("H");
    public static final EntityDescriptor I = EntityDescriptor.of("I");
    public static final EntityDescriptor J = EntityDescriptor.of("J");
    public static final EntityDescriptor K = EntityDescriptor.of("K");
    public static final EntityDescriptor L = EntityDescriptor.of("L");
    public static final EntityDescriptor Z = EntityDescriptor.of("Z");
    public static final EntityDescriptor W = EntityDescriptor.of("W");
    public static final EntityDescriptor ZZ = EntityDescriptor.of("ZZ");

    /**
     * Registration order of the "CAT" catalog, repeated A included.
     */
    public static final List<EntityDescriptor> REGISTRATION_ORDER =
            List.of(C, D, Z, H, I, E, T, L, B, A, J, A, G, K, A, F, W);

    private SampleHierarchy() {
    }

    public static EdgeSetSubtypeRelation relation() {
        return EdgeSetSubtypeRelation.builder()
                .entity(B, A)
                .entity(C, A)
                .entity(T, B)
                .entity(D, C)
                .entity(E, C)
                .entity(G, F)
                .entity(H, F)
                .entity(L, G)
                .entity(Z, G)
                .entity(I, H)
                .entity(J, H)
                .entity(K, I, J)
                .entity(W, K)
                .build();
    }
}
