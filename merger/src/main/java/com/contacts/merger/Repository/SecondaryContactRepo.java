package com.contacts.merger.Repository;

import com.contacts.merger.configration.RetryUtils;
import com.contacts.merger.exception.ContactSourceException;
import com.contacts.merger.model.DatabaseSource;
import com.contacts.merger.model.SecondaryContact;
import com.contacts.merger.service.SecondaryContactFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.stereotype.Repository;

import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads secondary contacts straight from the SQL Server patient database. The connection is
 * opened per call from the credentials of the merge request.
 */
@Repository
public class SecondaryContactRepo {

    private static final Logger logger = LoggerFactory.getLogger(SecondaryContactRepo.class);

    public static final String DEFAULT_QUERY = "select DISTINCT patientnamear, patientaddress, patientphone, patienttel, PFax "
            + "from patients_1..patientinfo "
            + "where patienttel != 'NULL' or patientaddress != 'NULL' or PFax != 'NULL' or patientphone != 'NULL' "
            + "order by patientnamear asc";

    private final SecondaryContactFactory secondaryContactFactory;

    @Value("${merger.db.query:}")
    private String configuredQuery;

    @Value("${merger.db.connect-attempts:3}")
    private int connectAttempts = 3;

    @Value("${merger.db.retry-delay-ms:2000}")
    private long retryDelayMs = 2000;

    public SecondaryContactRepo(SecondaryContactFactory secondaryContactFactory) {
        this.secondaryContactFactory = secondaryContactFactory;
    }

    public Map<String, SecondaryContact> loadContacts(DatabaseSource source) {
        logger.info("Loading secondary contacts from database: {}/{}", source.getServer(), source.getDatabase());
        String query = resolveQuery(source);
        JdbcOperations jdbc = openTemplate(source);

        Map<String, SecondaryContact> contacts = new LinkedHashMap<>();
        try {
            RetryUtils.retry(connectAttempts, retryDelayMs, () -> {
                contacts.clear();
                jdbc.query(query, (RowCallbackHandler) rs -> {
                    ResultSetMetaData meta = rs.getMetaData();
                    String fullName = rs.getString(1);
                    List<String> phoneCells = new ArrayList<>();
                    for (int i = 2; i <= meta.getColumnCount(); i++) {
                        String cell = rs.getString(i);
                        if (cell != null) {
                            phoneCells.add(cell);
                        }
                    }
                    Map.Entry<String, SecondaryContact> entry = secondaryContactFactory.fromRow(fullName, phoneCells);
                    if (entry != null) {
                        contacts.put(entry.getKey(), entry.getValue());
                    }
                });
                return contacts.size();
            });
        } catch (RetryUtils.RetryExhaustedException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("❌ Cannot load contacts from {}/{}. Last error: {}", source.getServer(), source.getDatabase(), cause.getMessage());
            throw new ContactSourceException("Cannot load contacts from database " + source.getDatabase(), cause);
        }

        logger.info("Loaded {} contacts from database.", contacts.size());
        return contacts;
    }

    protected JdbcOperations openTemplate(DatabaseSource source) {
        String url = "jdbc:sqlserver://" + source.getServer()
                + ";databaseName=" + source.getDatabase()
                + ";encrypt=true;trustServerCertificate=true;loginTimeout=10";
        DriverManagerDataSource dataSource = new DriverManagerDataSource(url, source.getUser(), source.getPassword());
        return new JdbcTemplate(dataSource);
    }

    private String resolveQuery(DatabaseSource source) {
        if (source.getQuery() != null && !source.getQuery().isBlank()) {
            return source.getQuery();
        }
        if (configuredQuery != null && !configuredQuery.isBlank()) {
            return configuredQuery;
        }
        return DEFAULT_QUERY;
    }
}
