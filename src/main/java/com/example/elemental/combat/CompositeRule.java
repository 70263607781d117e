package com.example.elemental.combat;

import com.example.elemental.model.Element;
import com.example.elemental.model.ElementPower;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.DoubleUnaryOperator;

/**
 * Recipe for merging several attack elements into one composite element.
 *
 * A rule applies when the attack carries at least {@code requiredElementCount} distinct
 * elements, includes every input element, and its total power meets the minimum threshold.
 */
public class CompositeRule {

    private final List<Element> inputElements;
    private final Map<Element, Double> elementWeights = new EnumMap<>(Element.class);
    private CombineMethod combineMethod = CombineMethod.AVERAGE;
    private DoubleUnaryOperator customCurve = PowerCurve.linear();
    private Element resultElement = Element.NONE;
    private String resultName = "";
    private double powerMultiplier = 1.0;
    private double minimumPowerThreshold = 0.0;
    private int requiredElementCount = 2;

    public CompositeRule(List<Element> inputElements) {
        this.inputElements = Collections.unmodifiableList(new ArrayList<>(inputElements));
    }

    public CompositeRule combineMethod(CombineMethod method) {
        this.combineMethod = method == null ? CombineMethod.AVERAGE : method;
        return this;
    }

    public CompositeRule weight(Element element, double weight) {
        elementWeights.put(element, weight);
        return this;
    }

    public CompositeRule customCurve(DoubleUnaryOperator curve) {
        this.customCurve = curve == null ? PowerCurve.linear() : curve;
        return this;
    }

    public CompositeRule result(Element element, String name) {
        this.resultElement = element == null ? Element.NONE : element;
        this.resultName = name == null ? "" : name;
        return this;
    }

    public CompositeRule powerMultiplier(double multiplier) {
        this.powerMultiplier = multiplier;
        return this;
    }

    public CompositeRule minimumPowerThreshold(double threshold) {
        this.minimumPowerThreshold = threshold;
        return this;
    }

    public CompositeRule requiredElementCount(int count) {
        this.requiredElementCount = count;
        return this;
    }

    public boolean canCombine(List<ElementPower> pairs) {
        Set<Element> present = new LinkedHashSet<>();
        double totalPower = 0.0;
        for (ElementPower p : pairs) {
            present.add(p.element());
            totalPower += p.power();
        }
        if (present.size() < requiredElementCount) return false;
        if (!present.containsAll(inputElements)) return false;
        return totalPower >= minimumPowerThreshold;
    }

    /**
     * Merge the pairs into one composite. Returns a non-composite result when the rule does not apply.
     */
    public Composition combine(List<ElementPower> pairs) {
        List<Element> sources = new ArrayList<>(pairs.size());
        for (ElementPower p : pairs) sources.add(p.element());
        if (!canCombine(pairs)) {
            return new Composition(Element.NONE, 0.0, sources, false, "");
        }
        double combined = combinedPower(pairs);
        Element element = resultElement != Element.NONE ? resultElement
            : (pairs.isEmpty() ? Element.NONE : pairs.get(0).element());
        return new Composition(element, combined * powerMultiplier, sources, true, resultName);
    }

    double combinedPower(List<ElementPower> pairs) {
        if (pairs.isEmpty()) return 0.0;
        switch (combineMethod) {
            case AVERAGE:
                return average(pairs);
            case HIGHEST: {
                double highest = 0.0;
                for (ElementPower p : pairs) highest = Math.max(highest, p.power());
                return highest;
            }
            case LOWEST: {
                double lowest = Double.MAX_VALUE;
                for (ElementPower p : pairs) lowest = Math.min(lowest, p.power());
                return lowest;
            }
            case WEIGHTED:
                return weighted(pairs);
            case CUSTOM_CURVE: {
                double normalized = Math.max(0.0, Math.min(1.0, average(pairs) / 100.0));
                return customCurve.applyAsDouble(normalized) * 100.0;
            }
            default:
                return pairs.get(0).power();
        }
    }

    private static double average(List<ElementPower> pairs) {
        double sum = 0.0;
        for (ElementPower p : pairs) sum += p.power();
        return sum / pairs.size();
    }

    private double weighted(List<ElementPower> pairs) {
        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (ElementPower p : pairs) {
            double w = getWeight(p.element());
            weightedSum += p.power() * w;
            totalWeight += w;
        }
        return totalWeight > 0 ? weightedSum / totalWeight : 0.0;
    }

    public double getWeight(Element element) {
        Double w = elementWeights.get(element);
        return w != null ? w : 1.0;
    }

    public List<Element> getInputElements() { return inputElements; }
    public CombineMethod getCombineMethod() { return combineMethod; }
    public Element getResultElement() { return resultElement; }
    public String getResultName() { return resultName; }
    public double getPowerMultiplier() { return powerMultiplier; }
    public double getMinimumPowerThreshold() { return minimumPowerThreshold; }
    public int getRequiredElementCount() { return requiredElementCount; }

    @Override
    public String toString() {
        return "CompositeRule{" + inputElements + " -> " + resultElement
            + (resultName.isEmpty() ? "" : " (" + resultName + ")") + ", " + combineMethod
            + " x" + powerMultiplier + "}";
    }
}
