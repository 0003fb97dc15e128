package com.di.ledger.file;

import com.di.ledger.exception.ValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A run number with the set of sub-run (lumi section) numbers a file covers in it.
 * Immutable; {@link #merge(Run)} returns the union of two entries for the same run.
 */
@Getter
@EqualsAndHashCode
public final class Run implements Comparable<Run> {

    private final int runNumber;
    private final SortedSet<Integer> lumis;

    public Run(int runNumber, Collection<Integer> lumis) {
        if (runNumber < 0) {
            throw new ValidationException("run number cannot be negative: " + runNumber);
        }
        if (lumis == null || lumis.isEmpty()) {
            throw new ValidationException("run " + runNumber + " must cover at least one lumi section");
        }
        this.runNumber = runNumber;
        this.lumis = Collections.unmodifiableSortedSet(new TreeSet<>(lumis));
    }

    public static Run of(int runNumber, Integer... lumis) {
        return new Run(runNumber, Arrays.asList(lumis));
    }

    public Run merge(Run other) {
        if (other.runNumber != runNumber) {
            throw new ValidationException(
                    String.format("Cannot merge run %d into run %d", other.runNumber, runNumber));
        }
        TreeSet<Integer> union = new TreeSet<>(lumis);
        union.addAll(other.lumis);
        return new Run(runNumber, union);
    }

    @Override
    public int compareTo(Run o) {
        return Integer.compare(runNumber, o.runNumber);
    }

    @Override
    public String toString() {
        return "Run(" + runNumber + ", lumis=" + lumis + ")";
    }
}
