/** Storage of the authorization view of school entities. */
package com.smartcampus.database.resource;
