package com.pharmaintel.engine;

import com.pharmaintel.domain.AbcClassification;
import com.pharmaintel.domain.InventoryState;
import com.pharmaintel.exception.InvalidEngineInputException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class AbcClassifier {

    private static final double A_SHARE = 0.70;
    private static final double B_SHARE = 0.90;

    public List<AbcClassification> classifyAbc(List<InventoryState> states) {
        if (states == null || states.isEmpty()) {
            return List.of();
        }
        Map<String, Double> valueByItem = new LinkedHashMap<>();
        for (InventoryState state : states) {
            if (state.getItemId() == null) {
                throw new InvalidEngineInputException("itemId is required");
            }
            valueByItem.merge(state.getItemId(), state.getQuantityOnHand() * state.getUnitCost(), Double::sum);
        }
        List<Map.Entry<String, Double>> ranked = new ArrayList<>(valueByItem.entrySet());
        ranked.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
            .thenComparing(Map.Entry.comparingByKey()));

        double total = ranked.stream().mapToDouble(Map.Entry::getValue).sum();
        List<AbcClassification> out = new ArrayList<>(ranked.size());
        double cumulative = 0.0;
        for (Map.Entry<String, Double> entry : ranked) {
            cumulative += entry.getValue();
            double share = total > 0.0 ? cumulative / total : 1.0;
            AbcClassification.AbcClass abcClass;
            if (total <= 0.0) {
                abcClass = AbcClassification.AbcClass.C;
            } else if (share <= A_SHARE + 1e-9) {
                abcClass = AbcClassification.AbcClass.A;
            } else if (share <= B_SHARE + 1e-9) {
                abcClass = AbcClassification.AbcClass.B;
            } else {
                abcClass = AbcClassification.AbcClass.C;
            }
            out.add(AbcClassification.builder()
                .itemId(entry.getKey())
                .inventoryValue(EngineMath.round(entry.getValue()))
                .cumulativeShare(EngineMath.round(share))
                .abcClass(abcClass)
                .build());
        }
        return List.copyOf(out);
    }
}
