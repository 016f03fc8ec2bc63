package com.warewise.service.rules;

import com.warewise.model.RuleType;
import com.warewise.service.rules.evaluator.DataIntegrityEvaluator;
import com.warewise.service.rules.evaluator.InvalidLocationEvaluator;
import com.warewise.service.rules.evaluator.LocationSpecificStagnantEvaluator;
import com.warewise.service.rules.evaluator.LocationTypeMismatchEvaluator;
import com.warewise.service.rules.evaluator.MissingLocationEvaluator;
import com.warewise.service.rules.evaluator.OvercapacityEvaluator;
import com.warewise.service.rules.evaluator.StagnantPalletsEvaluator;
import com.warewise.service.rules.evaluator.TemperatureZoneMismatchEvaluator;
import com.warewise.service.rules.evaluator.UncoordinatedLotsEvaluator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Maps each {@link RuleType} to its evaluator. The switch is exhaustive, so a new rule type
 * does not compile until it has an evaluator.
 */
@Component
@RequiredArgsConstructor
public class RuleEvaluatorRegistry {

    private final StagnantPalletsEvaluator stagnantPallets;
    private final UncoordinatedLotsEvaluator uncoordinatedLots;
    private final OvercapacityEvaluator overcapacity;
    private final InvalidLocationEvaluator invalidLocation;
    private final LocationSpecificStagnantEvaluator locationSpecificStagnant;
    private final TemperatureZoneMismatchEvaluator temperatureZoneMismatch;
    private final DataIntegrityEvaluator dataIntegrity;
    private final LocationTypeMismatchEvaluator locationTypeMismatch;
    private final MissingLocationEvaluator missingLocation;

    /**
     * Registry with one fresh instance of every evaluator.
     */
    public static RuleEvaluatorRegistry withDefaultEvaluators() {
        return new RuleEvaluatorRegistry(
                new StagnantPalletsEvaluator(),
                new UncoordinatedLotsEvaluator(),
                new OvercapacityEvaluator(),
                new InvalidLocationEvaluator(),
                new LocationSpecificStagnantEvaluator(),
                new TemperatureZoneMismatchEvaluator(),
                new DataIntegrityEvaluator(),
                new LocationTypeMismatchEvaluator(),
                new MissingLocationEvaluator());
    }

    public RuleEvaluator evaluatorFor(RuleType type) {
        return switch (type) {
            case STAGNANT_PALLETS -> stagnantPallets;
            case UNCOORDINATED_LOTS -> uncoordinatedLots;
            case OVERCAPACITY -> overcapacity;
            case INVALID_LOCATION -> invalidLocation;
            case LOCATION_SPECIFIC_STAGNANT -> locationSpecificStagnant;
            case TEMPERATURE_ZONE_MISMATCH -> temperatureZoneMismatch;
            case DATA_INTEGRITY -> dataIntegrity;
            case LOCATION_TYPE_MISMATCH -> locationTypeMismatch;
            case MISSING_LOCATION -> missingLocation;
        };
    }
}
