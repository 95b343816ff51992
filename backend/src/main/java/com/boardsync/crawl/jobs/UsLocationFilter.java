package com.boardsync.crawl.jobs;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Accepts a posting only when its primary or an alternate location is confirmed as being in the United States.
 * Locations that name no recognizable place (for example a bare "Remote") are not confirmed.
 */
@Component
public class UsLocationFilter {
    private static final Pattern SEGMENT_SPLIT = Pattern.compile("\\s*(?:;|\\||/|\\n|\\bor\\b|\\band\\b)\\s*");
    private static final Pattern STATE_CODE = Pattern.compile(
        "(?:^|[\\s,(\\-])(AL|AK|AZ|AR|CA|CO|CT|DE|FL|GA|HI|ID|IL|IN|IA|KS|KY|LA|ME|MD|MA|MI|MN|MS|MO|MT|NE|NV|NH|NJ|NM|NY|NC|ND|OH|OK|OR|PA|RI|SC|SD|TN|TX|UT|VT|VA|WA|WV|WI|WY|DC)(?:$|[\\s,)\\-])"
    );
    private static final Pattern COUNTRY = Pattern.compile(
        "(?i)(?:united states|\\busa\\b|\\bu\\.s\\.)|(?-i:\\bUS\\b)"
    );

    private static final Set<String> STATES = Set.of(
        "alabama", "alaska", "arizona", "arkansas", "california", "colorado", "connecticut", "delaware",
        "florida", "georgia", "hawaii", "idaho", "illinois", "indiana", "iowa", "kansas", "kentucky",
        "louisiana", "maine", "maryland", "massachusetts", "michigan", "minnesota", "mississippi", "missouri",
        "montana", "nebraska", "nevada", "new hampshire", "new jersey", "new mexico", "new york",
        "north carolina", "north dakota", "ohio", "oklahoma", "oregon", "pennsylvania", "rhode island",
        "south carolina", "south dakota", "tennessee", "texas", "utah", "vermont", "virginia", "washington",
        "west virginia", "wisconsin", "wyoming", "district of columbia"
    );

    private static final Set<String> CITIES = Set.of(
        "san francisco", "bay area", "silicon valley", "palo alto", "mountain view", "menlo park", "sunnyvale",
        "san jose", "oakland", "berkeley", "redwood city", "san mateo", "santa clara", "los angeles",
        "santa monica", "san diego", "irvine", "seattle", "bellevue", "redmond", "portland", "boston",
        "cambridge, ma", "somerville", "chicago", "austin", "dallas", "houston", "denver", "boulder", "atlanta",
        "miami", "phoenix", "salt lake city", "nashville", "pittsburgh", "philadelphia", "washington, d.c.",
        "washington dc", "nyc", "brooklyn", "manhattan", "raleigh", "durham", "minneapolis", "detroit",
        "columbus", "charlotte", "las vegas", "baltimore", "st. louis", "kansas city"
    );

    private static final List<String> NON_US = List.of(
        "canada", "toronto", "vancouver", "montreal", "ontario", "british columbia", "united kingdom", "england",
        "london", "scotland", "ireland", "dublin", "germany", "berlin", "munich", "france", "paris", "spain",
        "madrid", "barcelona", "netherlands", "amsterdam", "india", "bangalore", "bengaluru", "hyderabad",
        "singapore", "australia", "sydney", "melbourne", "japan", "tokyo", "mexico", "brazil", "são paulo",
        "sao paulo", "argentina", "colombia", "israel", "tel aviv", "poland", "warsaw", "portugal", "lisbon",
        "switzerland", "zurich", "sweden", "stockholm", "emea", "apac", "latam", "europe", "remote - uk",
        "philippines", "korea", "china", "hong kong", "taiwan"
    );
    private static final Pattern UK = Pattern.compile("\\bUK\\b");

    public boolean isUsLocation(String location, String alternateLocations) {
        return confirmsUs(location) || confirmsUs(alternateLocations);
    }

    private boolean confirmsUs(String location) {
        if (location == null || location.isBlank()) {
            return false;
        }
        for (String segment : SEGMENT_SPLIT.split(location.trim())) {
            if (segmentIsUs(segment)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A spelled-out state name outranks foreign place names ("New Mexico", "Indiana"); foreign names outrank
     * two-letter state codes, which collide with country codes ("Toronto, ON, CA").
     */
    private boolean segmentIsUs(String segment) {
        if (segment.isBlank()) {
            return false;
        }
        if (COUNTRY.matcher(segment).find()) {
            return true;
        }
        String lower = segment.toLowerCase(Locale.ROOT);
        for (String state : STATES) {
            if (containsWord(lower, state)) {
                return true;
            }
        }
        if (UK.matcher(segment).find() || NON_US.stream().anyMatch(term -> containsWord(lower, term))) {
            return false;
        }
        if (STATE_CODE.matcher(segment).find()) {
            return true;
        }
        for (String city : CITIES) {
            if (lower.contains(city)) {
                return true;
            }
        }
        return false;
    }

    private boolean containsWord(String haystack, String word) {
        int index = haystack.indexOf(word);
        while (index >= 0) {
            boolean startOk = index == 0 || !Character.isLetter(haystack.charAt(index - 1));
            int end = index + word.length();
            boolean endOk = end == haystack.length() || !Character.isLetter(haystack.charAt(end));
            if (startOk && endOk) {
                return true;
            }
            index = haystack.indexOf(word, index + 1);
        }
        return false;
    }
}
