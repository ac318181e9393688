package com.plant.flowsheet.component;

import com.plant.flowsheet.api.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Divides one stream into several with the same composition.
 *
 * Modes:
 * - RATIO: output i gets {@code Q * ratio[i] / sum(ratio)}.
 * - THRESHOLD: two outputs; the first gets the flow up to the threshold, the
 * second everything above it.
 * - FIXED_SECOND: two outputs; the second gets a fixed flow (capped at Q), the
 * first the remainder. This is the internal-recycle pump of an activated
 * sludge plant.
 *
 * An output with zero flow is a zero vector. If the inlet carries no flow,
 * every output is the inlet composition with zero flow.
 */
public final class SplitterComponent implements Component {

    public enum Mode {
        RATIO,
        THRESHOLD,
        FIXED_SECOND
    }

    private final String inputPort;
    private final List<String> outputPorts;
    private final Mode mode;
    private final double[] ratios;
    private final double flowSetting;
    private final int flowIndex;

    private SplitterComponent(String inputPort, List<String> outputPorts, Mode mode, double[] ratios,
            double flowSetting, int flowIndex) {
        this.inputPort = inputPort;
        this.outputPorts = List.copyOf(outputPorts);
        this.mode = mode;
        this.ratios = ratios;
        this.flowSetting = flowSetting;
        this.flowIndex = flowIndex;
    }

    public static SplitterComponent ratio(String inputPort, List<String> outputPorts, double[] ratios,
            int flowIndex) {
        if (ratios.length != outputPorts.size())
            throw new IllegalArgumentException(
                    ratios.length + " split ratios for " + outputPorts.size() + " output ports");
        double sum = 0.0;
        for (double r : ratios) {
            if (r < 0 || !Double.isFinite(r))
                throw new IllegalArgumentException("Split ratios must be finite and non-negative");
            sum += r;
        }
        if (sum <= 0)
            throw new IllegalArgumentException("Split ratios must not all be zero");
        return new SplitterComponent(inputPort, outputPorts, Mode.RATIO, ratios.clone(), 0.0, flowIndex);
    }

    public static SplitterComponent threshold(String inputPort, List<String> outputPorts, double threshold,
            int flowIndex) {
        return twoWay(inputPort, outputPorts, Mode.THRESHOLD, threshold, flowIndex);
    }

    public static SplitterComponent fixedSecond(String inputPort, List<String> outputPorts, double flow,
            int flowIndex) {
        return twoWay(inputPort, outputPorts, Mode.FIXED_SECOND, flow, flowIndex);
    }

    private static SplitterComponent twoWay(String inputPort, List<String> outputPorts, Mode mode, double flow,
            int flowIndex) {
        if (outputPorts.size() != 2)
            throw new IllegalArgumentException(mode + " splitter needs exactly 2 output ports, got "
                    + outputPorts.size());
        if (flow < 0 || !Double.isFinite(flow))
            throw new IllegalArgumentException(mode + " flow must be finite and non-negative: " + flow);
        return new SplitterComponent(inputPort, outputPorts, mode, null, flow, flowIndex);
    }

    public Mode mode() {
        return mode;
    }

    @Override
    public Map<String, double[]> step(Map<String, double[]> inputs, double dt) {
        double[] in = inputs.get(inputPort);
        if (in == null)
            return Map.of();
        Streams.checkWidth(in, flowIndex);

        double q = in[flowIndex];
        Map<String, double[]> out = new HashMap<>(outputPorts.size() * 2);
        if (q == 0.0) {
            for (String port : outputPorts)
                out.put(port, Streams.withFlow(in, flowIndex, 0.0));
            return out;
        }

        double[] flows = flows(q);
        for (int i = 0; i < flows.length; i++)
            out.put(outputPorts.get(i), flows[i] > 0 ? Streams.withFlow(in, flowIndex, flows[i])
                    : new double[in.length]);
        return out;
    }

    private double[] flows(double q) {
        switch (mode) {
            case THRESHOLD:
                return q >= flowSetting ? new double[] { flowSetting, q - flowSetting } : new double[] { q, 0.0 };
            case FIXED_SECOND:
                return q >= flowSetting ? new double[] { q - flowSetting, flowSetting } : new double[] { 0.0, q };
            default:
                double sum = 0.0;
                for (double r : ratios)
                    sum += r;
                double[] f = new double[ratios.length];
                for (int i = 0; i < f.length; i++)
                    f[i] = q * ratios[i] / sum;
                return f;
        }
    }
}
