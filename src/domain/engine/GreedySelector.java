package domain.engine;

import domain.model.ArmorItem;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy armor selection by defense-per-gold efficiency.
 *
 * <p>Each round scans the remaining pool, considers only items that still fit the residual
 * budget ({@code spent + cost <= budget}, non-strict), and takes the one with the greatest
 * {@code defense / cost}. The round repeats until the pool is empty or nothing fits.
 *
 * <p><b>Tie-break:</b> comparison is strict {@code >}, so among equally efficient items the
 * first one in pool order wins.
 *
 * <p><b>Correctness guarantee:</b> feasible, NOT optimal (classic greedy-on-0/1 gap).
 * <br><b>Time:</b> O(n²): up to n rounds, each scanning the pool.
 */
public final class GreedySelector implements ArmorSelector {

    @Override
    public List<ArmorItem> select(List<ArmorItem> armors, double goldBudget) {
        List<ArmorItem> result = new ArrayList<>();
        if (goldBudget <= 0.0 || armors.isEmpty()) {
            return result;
        }

        List<ArmorItem> todo = new ArrayList<>(armors);
        double spent = 0.0;

        while (!todo.isEmpty()) {
            int bestIndex = -1;
            double bestEfficiency = 0.0;

            for (int i = 0; i < todo.size(); i++) {
                ArmorItem armor = todo.get(i);
                if (spent + armor.getCost() > goldBudget) {
                    continue;
                }
                double efficiency = armor.getEfficiency();
                if (bestIndex < 0 || efficiency > bestEfficiency) {
                    bestIndex = i;
                    bestEfficiency = efficiency;
                }
            }

            if (bestIndex < 0) {
                break;  // Nothing left fits the residual budget
            }

            ArmorItem chosen = todo.remove(bestIndex);
            result.add(chosen);
            spent += chosen.getCost();
        }

        return result;
    }

    @Override
    public String name() {
        return "greedy";
    }
}
