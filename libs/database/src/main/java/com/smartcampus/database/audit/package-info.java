/** JDBC-backed audit storage. */
package com.smartcampus.database.audit;
