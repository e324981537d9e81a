package com.smurthy.ai.shopping.agents;

import java.util.Locale;

final class Formats {

    private Formats() {
    }

    static String kg(double kg) {
        return String.format(Locale.ROOT, "%.2f kg CO2e", kg);
    }

    static String usd(double usd) {
        return String.format(Locale.ROOT, "$%.2f", usd);
    }
}
