/** Ownership links between users and the entities they are personally tied to. */
package com.smartcampus.database.link;
