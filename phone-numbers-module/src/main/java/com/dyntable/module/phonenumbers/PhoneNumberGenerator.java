package com.dyntable.module.phonenumbers;

import com.dyntable.module.spi.GenerationContext;
import com.dyntable.module.spi.ValueGenerator;

import java.util.Random;

/**
 * Generates realistic phone numbers for the countries known to {@link DialPlan}.
 */
public class PhoneNumberGenerator implements ValueGenerator {

    public static final String ID = "phone-number";

    @Override
    public Object generate(GenerationContext context) {
        DialPlan plan = DialPlan.of(context.stringOption("country", "US")).orElse(DialPlan.US);
        Random random = context.getRandom();

        int[][] ranges = plan.areaCodeRanges();
        int[] range = ranges[random.nextInt(ranges.length)];
        int areaCode = range[0] + random.nextInt(range[1] - range[0] + 1);

        StringBuilder subscriber = new StringBuilder();
        subscriber.append(2 + random.nextInt(8));
        for (int i = 1; i < plan.subscriberLength(); i++) {
            subscriber.append(random.nextInt(10));
        }
        String digits = plan.dialCode().substring(1) + areaCode + subscriber;
        return plan.format(digits);
    }
}
