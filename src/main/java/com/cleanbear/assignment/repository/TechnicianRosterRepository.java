package com.cleanbear.assignment.repository;

import com.cleanbear.assignment.dto.SheetValueRange;
import com.cleanbear.assignment.dto.TechnicianRecord;
import com.cleanbear.assignment.exception.RosterUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads the technician roster from a Google Sheets range. The first row is a header;
 * columns are matched by name, case-insensitively, so their order does not matter.
 */
@Repository
public class TechnicianRosterRepository {

    private static final Logger logger = LoggerFactory.getLogger(TechnicianRosterRepository.class);

    private static final Set<String> TRUTHY = Set.of("true", "1", "on", "yes", "y");

    private final RestTemplate restTemplate;
    private final String sheetsEndpoint;
    private final String spreadsheetId;
    private final String range;
    private final String apiKey;

    public TechnicianRosterRepository(RestTemplate restTemplate,
                                      @Value("${sheets.endpoint}") String sheetsEndpoint,
                                      @Value("${sheets.spreadsheet-id:}") String spreadsheetId,
                                      @Value("${sheets.range}") String range,
                                      @Value("${sheets.api-key:}") String apiKey) {
        this.restTemplate = restTemplate;
        this.sheetsEndpoint = sheetsEndpoint;
        this.spreadsheetId = spreadsheetId;
        this.range = range;
        this.apiKey = apiKey;
    }

    public boolean isConfigured() {
        return spreadsheetId != null && !spreadsheetId.isBlank();
    }

    /**
     * @throws RosterUnavailableException when the sheet cannot be fetched or has no {@code id} column
     */
    public List<TechnicianRecord> fetchTechnicians() {
        URI uri = UriComponentsBuilder.fromHttpUrl(sheetsEndpoint)
                .pathSegment("spreadsheets", spreadsheetId, "values", range)
                .queryParamIfPresent("key", Optional.ofNullable(apiKey).filter(k -> !k.isBlank()))
                .encode()
                .build()
                .toUri();

        SheetValueRange valueRange;
        try {
            logger.debug("Fetching technician roster from range {}", range);
            valueRange = restTemplate.getForObject(uri, SheetValueRange.class);
        } catch (RestClientException e) {
            throw new RosterUnavailableException("Failed to read roster range " + range, e);
        }

        if (valueRange == null || valueRange.getValues() == null || valueRange.getValues().size() < 2) {
            logger.warn("Roster range {} has no data rows", range);
            return List.of();
        }

        List<TechnicianRecord> records = parseRows(valueRange.getValues());
        logger.info("Fetched {} technicians from roster range {}", records.size(), range);
        return records;
    }

    List<TechnicianRecord> parseRows(List<List<String>> rows) {
        Map<String, Integer> header = new HashMap<>();
        List<String> headerRow = rows.get(0);
        for (int i = 0; i < headerRow.size(); i++) {
            if (headerRow.get(i) != null) {
                header.putIfAbsent(headerRow.get(i).trim().toLowerCase(Locale.ROOT), i);
            }
        }
        if (!header.containsKey("id")) {
            throw new RosterUnavailableException("Roster header has no 'id' column: " + headerRow);
        }

        List<TechnicianRecord> records = new ArrayList<>();
        for (List<String> row : rows.subList(1, rows.size())) {
            String id = cell(row, header, "id");
            if (id.isEmpty()) {
                continue;
            }

            TechnicianRecord record = new TechnicianRecord();
            record.setTechnicianId(id);
            record.setName(cell(row, header, "name"));
            record.setPhone(cell(row, header, "phone"));
            record.setArea(cell(row, header, "area"));
            record.setHomeLat(parseCoordinate(cell(row, header, "home_lat")));
            record.setHomeLng(parseCoordinate(cell(row, header, "home_lng")));
            record.setHomeAddress(cell(row, header, "home_address"));
            record.setServiceTypes(Arrays.stream(cell(row, header, "service_types").split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toList()));
            // A sheet without the column allows overtime for everyone.
            record.setOvertimeAllowed(!header.containsKey("overtime_allowed")
                    || TRUTHY.contains(cell(row, header, "overtime_allowed").toLowerCase(Locale.ROOT)));
            records.add(record);
        }
        return records;
    }

    private static String cell(List<String> row, Map<String, Integer> header, String column) {
        Integer index = header.get(column);
        if (index == null || index >= row.size() || row.get(index) == null) {
            return "";
        }
        return row.get(index).trim();
    }

    private static Double parseCoordinate(String value) {
        if (value.isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring unparsable roster coordinate '{}'", value);
            return null;
        }
    }
}
