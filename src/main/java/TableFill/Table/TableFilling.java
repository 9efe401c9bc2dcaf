package TableFill.Table;

import TableFill.Model.Automaton;
import TableFill.Model.MarkedPair;
import TableFill.Model.MarkingPhase;
import TableFill.Model.MarkingTrace;
import TableFill.Model.StatePair;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ForkJoinPool;

/**
 * Table-filling (Moore) computation of the distinguishability relation of a DFA.
 * <p>
 * Phase A marks every pair with exactly one accepting state. Phase B marks (p, q) whenever some symbol moves
 * both states, to different states, and that successor pair is already marked, until nothing changes.
 * <p>
 * A symbol on which only one of the two states has a move is skipped: a partial transition function is not
 * taken as evidence that two states differ. This is not the textbook treatment of missing moves as a rejecting
 * sink, and it means states with identical defined behaviour but different domains stay unmarked.
 * <p>
 * The input is expected to contain reachable states only (see {@code Reachability}).
 */
public final class TableFilling {
    public static final String BASE_CASE_LABEL = "Base case";
    public static final String BASE_CASE_DESCRIPTION = "pairs where one state is accepting and the other is not";
    public static final String PASS_LABEL = "Pass ";
    public static final String PASS_DESCRIPTION = "pairs with a distinguishing transition";
    public static final String PROPAGATION_LABEL = "Propagation";
    public static final String PROPAGATION_DESCRIPTION = "pairs reached backwards from distinguishable pairs";

    private TableFilling() {}

    public static DistinguishabilityTable computeMarking(Automaton automaton) {
        return computeMarking(automaton, MarkingStrategy.PASSES, MarkingTrace.noop());
    }

    /**
     * Build the pair table, mark the base case and close it under the transition rule.
     * @param automaton - automaton over reachable states
     * @param strategy - how to compute the closure
     * @param trace - receives one phase for the base case and one per productive step
     * @return saturated table; a pair is unmarked iff its states are equivalent
     */
    public static DistinguishabilityTable computeMarking(
        Automaton automaton, MarkingStrategy strategy, MarkingTrace trace) {
        final DistinguishabilityTable table = new DistinguishabilityTable(automaton.size());
        final int[][] succ = createSuccArr(automaton);
        final IntArrayList basePairs = markBaseCase(table, automaton, trace);
        switch (strategy) {
            case PASSES -> saturateByPasses(table, automaton, succ, trace);
            case WORKLIST -> saturateByWorklist(table, automaton, succ, basePairs, trace);
            case PARALLEL -> saturateInParallel(table, automaton, succ, trace);
            default -> throw new IllegalStateException("Unexpected marking strategy: " + strategy);
        }
        return table;
    }

    // succ[a][p] is the successor of p on symbol a, or Automaton.NO_MOVE
    static int[][] createSuccArr(Automaton automaton) {
        final int nStates = automaton.size();
        final int nSymbols = automaton.numSymbols();
        final int[][] succ = new int[nSymbols][nStates];
        for (int a = 0; a < nSymbols; a++) {
            for (int p = 0; p < nStates; p++) {
                succ[a][p] = automaton.getSuccessor(p, a);
            }
        }
        return succ;
    }

    /**
     * Phase A.
     * @return the marked pairs, flattened as consecutive (p, q) ints
     */
    private static IntArrayList markBaseCase(
        DistinguishabilityTable table, Automaton automaton, MarkingTrace trace) {
        final int n = table.size();
        final IntArrayList marked = new IntArrayList();
        for (int p = 0; p < n; p++) {
            for (int q = p + 1; q < n; q++) {
                if (automaton.isAccepting(p) != automaton.isAccepting(q)) {
                    table.mark(p, q);
                    marked.add(p);
                    marked.add(q);
                }
            }
        }
        if (trace.isEnabled()) {
            final List<MarkedPair> pairs = new ArrayList<>(marked.size() / 2);
            for (int i = 0; i < marked.size(); i += 2) {
                pairs.add(MarkedPair.baseCase(statePair(automaton, marked.getInt(i), marked.getInt(i + 1))));
            }
            trace.record(new MarkingPhase(BASE_CASE_LABEL, BASE_CASE_DESCRIPTION, pairs));
        }
        return marked;
    }

    /**
     * First symbol that separates p and q under the current marks.
     * @return symbol id, or -1 if no symbol does (yet)
     */
    static int distinguishingSymbol(int p, int q, int[][] succ, DistinguishabilityTable table) {
        for (int a = 0; a < succ.length; a++) {
            final int sp = succ[a][p];
            final int sq = succ[a][q];
            if (sp == Automaton.NO_MOVE || sq == Automaton.NO_MOVE) {
                continue; // partial transition, not evidence of inequivalence
            }
            if (sp != sq && table.isMarked(sp, sq)) {
                return a;
            }
        }
        return -1;
    }

    private static void saturateByPasses(
        DistinguishabilityTable table, Automaton automaton, int[][] succ, MarkingTrace trace) {
        final int n = table.size();
        int pass = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            pass++;
            final List<MarkedPair> markedThisPass = new ArrayList<>();
            for (int p = 0; p < n; p++) {
                for (int q = p + 1; q < n; q++) {
                    if (table.isMarked(p, q)) {
                        continue;
                    }
                    final int a = distinguishingSymbol(p, q, succ, table);
                    if (a >= 0) {
                        table.mark(p, q);
                        changed = true;
                        if (trace.isEnabled()) {
                            markedThisPass.add(markedPair(automaton, p, q, a, succ));
                        }
                    }
                }
            }
            if (trace.isEnabled() && !markedThisPass.isEmpty()) {
                trace.record(new MarkingPhase(PASS_LABEL + pass, PASS_DESCRIPTION, markedThisPass));
            }
        }
        table.setPasses(pass);
    }

    /**
     * Queue-driven closure: when (r, s) is marked, every pair (p, q) with p -a-> r and q -a-> s gets marked.
     * Each marked pair is dequeued once, so the work is bounded by the number of predecessor pairs.
     */
    private static void saturateByWorklist(
        DistinguishabilityTable table, Automaton automaton, int[][] succ, IntArrayList basePairs,
        MarkingTrace trace) {
        final IntArrayList[][] pred = createPredArr(succ, table.size());
        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue(Math.max(2, basePairs.size()));
        for (int i = 0; i < basePairs.size(); i++) {
            queue.enqueue(basePairs.getInt(i));
        }

        final List<MarkedPair> propagated = new ArrayList<>();
        int rounds = 0;
        // each round drains the pairs enqueued by the previous one
        while (!queue.isEmpty()) {
            rounds++;
            int roundPairs = queue.size() / 2;
            for (int k = 0; k < roundPairs; k++) {
                final int r = queue.dequeueInt();
                final int s = queue.dequeueInt();
                for (int a = 0; a < succ.length; a++) {
                    final IntArrayList predR = pred[a][r];
                    final IntArrayList predS = pred[a][s];
                    if (predR == null || predS == null) {
                        continue;
                    }
                    for (int i = 0; i < predR.size(); i++) {
                        final int p = predR.getInt(i);
                        for (int j = 0; j < predS.size(); j++) {
                            final int q = predS.getInt(j);
                            // p != q always holds here, since r != s and each state has one a-successor
                            if (table.mark(p, q)) {
                                queue.enqueue(Math.min(p, q));
                                queue.enqueue(Math.max(p, q));
                                if (trace.isEnabled()) {
                                    propagated.add(markedPair(automaton, p, q, a, succ));
                                }
                            }
                        }
                    }
                }
            }
        }
        if (trace.isEnabled() && !propagated.isEmpty()) {
            trace.record(new MarkingPhase(PROPAGATION_LABEL, PROPAGATION_DESCRIPTION, propagated));
        }
        table.setPasses(rounds);
    }

    // pred[a][r] lists the states with an a-move into r; null when there are none
    private static IntArrayList[][] createPredArr(int[][] succ, int nStates) {
        final IntArrayList[][] pred = new IntArrayList[succ.length][nStates];
        for (int a = 0; a < succ.length; a++) {
            for (int p = 0; p < nStates; p++) {
                final int r = succ[a][p];
                if (r == Automaton.NO_MOVE) {
                    continue;
                }
                IntArrayList list = pred[a][r];
                if (list == null) {
                    list = new IntArrayList(2);
                    pred[a][r] = list;
                }
                list.add(p);
            }
        }
        return pred;
    }

    private static void saturateInParallel(
        DistinguishabilityTable table, Automaton automaton, int[][] succ, MarkingTrace trace) {
        final int n = table.size();
        int pass = 0;
        boolean changed = true;
        while (changed) {
            pass++;
            // the table is read-only while the shards run; their findings are applied after the join
            final IntArrayList found = ForkJoinPool.commonPool().invoke(new ParMarkTask(0, n, succ, table));
            changed = !found.isEmpty();
            final List<MarkedPair> markedThisPass = new ArrayList<>(found.size() / 3);
            for (int i = 0; i < found.size(); i += 3) {
                final int p = found.getInt(i);
                final int q = found.getInt(i + 1);
                table.mark(p, q);
                if (trace.isEnabled()) {
                    markedThisPass.add(markedPair(automaton, p, q, found.getInt(i + 2), succ));
                }
            }
            if (trace.isEnabled() && !markedThisPass.isEmpty()) {
                trace.record(new MarkingPhase(PASS_LABEL + pass, PASS_DESCRIPTION, markedThisPass));
            }
        }
        table.setPasses(pass);
    }

    /**
     * Scan rows [pStart, pEnd) against a table that is not modified concurrently.
     * @return (p, q, symbol) triples for every unmarked pair that has a distinguishing symbol, in row order
     */
    static IntArrayList scanRows(int pStart, int pEnd, int[][] succ, DistinguishabilityTable table) {
        final IntArrayList found = new IntArrayList();
        final int n = table.size();
        for (int p = pStart; p < pEnd; p++) {
            for (int q = p + 1; q < n; q++) {
                if (table.isMarked(p, q)) {
                    continue;
                }
                final int a = distinguishingSymbol(p, q, succ, table);
                if (a >= 0) {
                    found.add(p);
                    found.add(q);
                    found.add(a);
                }
            }
        }
        return found;
    }

    private static StatePair statePair(Automaton automaton, int p, int q) {
        final int lo = Math.min(p, q);
        final int hi = Math.max(p, q);
        return new StatePair(automaton.getStateName(lo), automaton.getStateName(hi));
    }

    private static MarkedPair markedPair(Automaton automaton, int p, int q, int a, int[][] succ) {
        return new MarkedPair(statePair(automaton, p, q), automaton.getSymbol(a),
            statePair(automaton, succ[a][p], succ[a][q]));
    }
}
