/**
 * Rendering of collection scopes into SQL, so that rows outside a caller's scope are filtered by
 * the database instead of after loading.
 */
package com.smartcampus.database.scope;
