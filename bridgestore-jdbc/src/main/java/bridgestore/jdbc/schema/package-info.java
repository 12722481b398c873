package bridgestore.jdbc.schema;
