package com.di.epistream.sql;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * SQL loaded from sql-queries.yml (epistream.sql.*).
 * The JDBC stores use these named statements; none of them carries inline SQL.
 */
@Component
@ConfigurationProperties(prefix = "epistream.sql")
public class SqlQueriesProperties {

    private Cases cases = new Cases();
    private Countries countries = new Countries();
    private Reliability reliability = new Reliability();
    private Runs runs = new Runs();

    public Cases getCases() { return cases; }
    public void setCases(Cases cases) { this.cases = cases; }
    public Countries getCountries() { return countries; }
    public void setCountries(Countries countries) { this.countries = countries; }
    public Reliability getReliability() { return reliability; }
    public void setReliability(Reliability reliability) { this.reliability = reliability; }
    public Runs getRuns() { return runs; }
    public void setRuns(Runs runs) { this.runs = runs; }

    public static class Cases {
        private String findHashesInRange;
        private String findHistoryInRange;
        private String upsert;
        private String rewrite;
        private String count;
        public String getFindHashesInRange() { return findHashesInRange; }
        public void setFindHashesInRange(String findHashesInRange) { this.findHashesInRange = findHashesInRange; }
        public String getFindHistoryInRange() { return findHistoryInRange; }
        public void setFindHistoryInRange(String findHistoryInRange) { this.findHistoryInRange = findHistoryInRange; }
        public String getUpsert() { return upsert; }
        public void setUpsert(String upsert) { this.upsert = upsert; }
        public String getRewrite() { return rewrite; }
        public void setRewrite(String rewrite) { this.rewrite = rewrite; }
        public String getCount() { return count; }
        public void setCount(String count) { this.count = count; }
    }

    public static class Countries {
        private String upsert;
        private String findAll;
        private String findAliases;
        private String insertAlias;
        public String getUpsert() { return upsert; }
        public void setUpsert(String upsert) { this.upsert = upsert; }
        public String getFindAll() { return findAll; }
        public void setFindAll(String findAll) { this.findAll = findAll; }
        public String getFindAliases() { return findAliases; }
        public void setFindAliases(String findAliases) { this.findAliases = findAliases; }
        public String getInsertAlias() { return insertAlias; }
        public void setInsertAlias(String insertAlias) { this.insertAlias = insertAlias; }
    }

    public static class Reliability {
        private String findLatestVersion;
        private String findByVersion;
        private String insert;
        public String getFindLatestVersion() { return findLatestVersion; }
        public void setFindLatestVersion(String findLatestVersion) { this.findLatestVersion = findLatestVersion; }
        public String getFindByVersion() { return findByVersion; }
        public void setFindByVersion(String findByVersion) { this.findByVersion = findByVersion; }
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
    }

    public static class Runs {
        private String insert;
        private String findRecent;
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getFindRecent() { return findRecent; }
        public void setFindRecent(String findRecent) { this.findRecent = findRecent; }
    }
}
