package com.gridcast.service;

import com.gridcast.exception.StoreTransactionException;
import com.gridcast.model.FeedType;
import com.gridcast.model.MavirColumn;
import com.gridcast.model.Station;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 实体元数据：只由元数据刷新写入，不触碰 start_date / end_date
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetadataRepository {

    private final DataSource dataSource;
    private final TransactionRunner transactionRunner;

    public int upsertStations(List<Station> stations) {
        if (stations.isEmpty()) return 0;
        String sql = """
            INSERT INTO omsz_meta (station_number, station_name, regio_name, county_name, latitude, longitude, elevation)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (station_number) DO UPDATE SET
                station_name = excluded.station_name,
                regio_name = excluded.regio_name,
                county_name = excluded.county_name,
                latitude = excluded.latitude,
                longitude = excluded.longitude,
                elevation = excluded.elevation
            """;
        int count = transactionRunner.inTransaction("upsert omsz_meta", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                for (Station s : stations) {
                    stmt.setInt(1, s.getStationNumber());
                    stmt.setString(2, s.getStationName());
                    stmt.setString(3, s.getRegioName());
                    stmt.setString(4, s.getCountyName());
                    setDouble(stmt, 5, s.getLatitude());
                    setDouble(stmt, 6, s.getLongitude());
                    setDouble(stmt, 7, s.getElevation());
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }
            return stations.size();
        });
        log.info("气象站元数据已更新: {} 个站点", count);
        return count;
    }

    public int upsertSeriesColumns(List<MavirColumn> columns) {
        String sql = """
            INSERT INTO mavir_meta (column_name, unit) VALUES (?, ?)
            ON CONFLICT (column_name) DO UPDATE SET unit = excluded.unit
            """;
        return transactionRunner.inTransaction("upsert mavir_meta", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                for (MavirColumn c : columns) {
                    stmt.setString(1, c.getApiName());
                    stmt.setString(2, MavirColumn.UNIT);
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }
            return columns.size();
        });
    }

    public Set<String> knownEntities(FeedType feed) {
        String sql = String.format("SELECT %s FROM %s ORDER BY %s",
                feed.getEntityColumn(), feed.getMetaTable(), feed.getEntityColumn());
        Set<String> out = new LinkedHashSet<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                out.add(JdbcSupport.readEntity(rs, feed.getEntityColumn(), feed));
            }
        } catch (SQLException e) {
            throw new StoreTransactionException("读取实体列表失败: " + feed, e);
        }
        return out;
    }

    private void setDouble(PreparedStatement stmt, int index, Double value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.DOUBLE);
        } else {
            stmt.setDouble(index, value);
        }
    }
}
