package com.plant.flowsheet.component;

import com.plant.flowsheet.api.ComputationException;

import java.util.List;

/**
 * Helpers for stream vectors in the ASM1 layout: concentrations plus one
 * volumetric flow element (index 14 by default).
 */
public final class Streams {
    /** Position of the volumetric flow in an ASM1 stream vector. */
    public static final int ASM1_FLOW_INDEX = 14;

    private Streams() {
    }

    /**
     * Flow-weighted mix of several streams. Every element except the flow is
     * averaged with the stream flows as weights; the flows are summed.
     * Streams without flow do not contribute. If no stream carries flow the
     * result is all zeros.
     *
     * @throws ComputationException if the streams differ in length or are too
     *                              short to hold a flow.
     */
    public static double[] mix(List<double[]> streams, int flowIndex) {
        int width = streams.get(0).length;
        for (double[] s : streams) {
            if (s.length != width)
                throw new ComputationException("Cannot mix streams of width " + width + " and " + s.length);
            checkWidth(s, flowIndex);
        }

        double[] out = new double[width];
        double total = 0.0;
        for (double[] s : streams) {
            double q = s[flowIndex];
            if (total + q == 0.0)
                continue;
            for (int j = 0; j < width; j++)
                if (j != flowIndex)
                    out[j] = (out[j] * total + s[j] * q) / (total + q);
            total += q;
        }
        out[flowIndex] = total;
        return out;
    }

    /** Copy of a stream with its flow replaced. */
    public static double[] withFlow(double[] stream, int flowIndex, double flow) {
        double[] out = stream.clone();
        out[flowIndex] = flow;
        return out;
    }

    static void checkWidth(double[] stream, int flowIndex) {
        if (stream.length <= flowIndex)
            throw new ComputationException(
                    "Stream of width " + stream.length + " has no flow element at index " + flowIndex);
    }
}
