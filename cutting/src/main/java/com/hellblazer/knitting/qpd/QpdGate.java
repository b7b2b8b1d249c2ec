/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Knitting.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.knitting.qpd;

import com.hellblazer.knitting.circuit.Operation;

import java.util.Objects;
import java.util.Optional;

/**
 * Placeholder marking a cut in a circuit, to be replaced by one term of its {@link QpdBasis}.
 *
 * A {@link Kind#TWO_PARTY} marker spans both parties of its basis and can only be resolved in an unseparated
 * circuit. A {@link Kind#ONE_PARTY} marker acts on one party of its basis; its counterpart lives in another
 * partition, and the two are tied together by a shared {@link CutIdentity}.
 *
 * @author hal.hildebrand
 */
public final class QpdGate implements Operation {

    public enum Kind {
        ONE_PARTY, TWO_PARTY
    }

    private final Kind        kind;
    private final QpdBasis    basis;
    private final int         partyIndex;
    private final String      label;
    private final CutIdentity cutIdentity;

    private QpdGate(Kind kind, QpdBasis basis, int partyIndex, String label, CutIdentity cutIdentity) {
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.basis = Objects.requireNonNull(basis, "basis cannot be null");
        this.label = label;
        this.cutIdentity = cutIdentity;
        this.partyIndex = partyIndex;

        if (kind == Kind.TWO_PARTY && basis.numParties() != 2) {
            throw new IllegalArgumentException(
            "A two-party marker requires a basis spanning two parties, not " + basis.numParties());
        }
        if (partyIndex < 0 || partyIndex >= basis.numParties()) {
            throw new IllegalArgumentException(
            String.format("Party index %d out of range [0, %d)", partyIndex, basis.numParties()));
        }
    }

    /**
     * Marker for a cut whose two parties both live in this circuit.
     */
    public static QpdGate twoParty(QpdBasis basis) {
        return new QpdGate(Kind.TWO_PARTY, basis, 0, null, null);
    }

    public static QpdGate twoParty(QpdBasis basis, String label) {
        return new QpdGate(Kind.TWO_PARTY, basis, 0, label, CutIdentity.fromLabel(label).orElse(null));
    }

    /**
     * Marker for one party of a cut. The cut identity is read from the label suffix {@code <free-text>_<id>}, if
     * present.
     */
    public static QpdGate oneParty(QpdBasis basis, int partyIndex, String label) {
        return new QpdGate(Kind.ONE_PARTY, basis, partyIndex, label, CutIdentity.fromLabel(label).orElse(null));
    }

    public static QpdGate oneParty(QpdBasis basis, int partyIndex, String label, CutIdentity cutIdentity) {
        Objects.requireNonNull(cutIdentity, "cutIdentity cannot be null");
        return new QpdGate(Kind.ONE_PARTY, basis, partyIndex, label, cutIdentity);
    }

    public Kind kind() {
        return kind;
    }

    public QpdBasis basis() {
        return basis;
    }

    /**
     * @return the party of the basis this marker acts on; 0 for two-party markers
     */
    public int partyIndex() {
        return partyIndex;
    }

    public Optional<String> label() {
        return Optional.ofNullable(label);
    }

    public Optional<CutIdentity> cutIdentity() {
        return Optional.ofNullable(cutIdentity);
    }

    @Override
    public String name() {
        return kind == Kind.TWO_PARTY ? "qpd_2q" : "qpd_1q";
    }

    @Override
    public int numQubits() {
        return kind == Kind.TWO_PARTY ? 2 : 1;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (QpdGate) obj;
        return kind == other.kind && partyIndex == other.partyIndex && basis.equals(other.basis) && Objects.equals(
        label, other.label) && Objects.equals(cutIdentity, other.cutIdentity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, basis, partyIndex, label, cutIdentity);
    }

    @Override
    public String toString() {
        return String.format("QpdGate{kind=%s, party=%d, label=%s, cut=%s, %s}", kind, partyIndex, label,
                             cutIdentity == null ? "?" : cutIdentity.value(), basis);
    }
}
