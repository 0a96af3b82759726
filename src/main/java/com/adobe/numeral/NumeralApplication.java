package com.adobe.numeral;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Numeral Conversion Service.
 * 
 * <p>Converts integers to and from symbolic numerals: extended Roman numerals
 * (signed, zero, Claudian and apostrophus large numbers) and bijective base-k
 * token sequences such as spreadsheet column letters.</p>
 * 
 * <h2>API Endpoints:</h2>
 * <ul>
 *   <li>GET /roman?query={integer}, GET /roman?min={integer}&amp;max={integer}</li>
 *   <li>GET /roman/decode?text={numeral}</li>
 *   <li>GET /letters?query={integer}, GET /letters/decode?text={letters}</li>
 *   <li>GET /tokens?query={integer}&amp;tokens={a,b,...}, GET /tokens/decode</li>
 * </ul>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
@SpringBootApplication
public class NumeralApplication {

    /**
     * Application entry point.
     * 
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(NumeralApplication.class, args);
    }
}
