package org.carball.autoindex.health;

import java.sql.SQLException;
import java.util.List;

public interface IndexStatsSource {

    List<ObservedIndexStats> collect() throws SQLException;
}
